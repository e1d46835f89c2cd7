package ai.swiftstyle.lint.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Splits Swift source into classified tokens. Punctuation and operators produce no token.
 */
public class SwiftLexer {

    static final Set<String> KEYWORDS = Set.of(
            "associatedtype", "class", "deinit", "enum", "extension", "fileprivate", "func", "import",
            "init", "inout", "internal", "let", "open", "operator", "private", "precedencegroup",
            "protocol", "public", "rethrows", "static", "struct", "subscript", "typealias", "var",
            "break", "case", "catch", "continue", "default", "defer", "do", "else", "fallthrough",
            "for", "guard", "if", "in", "repeat", "return", "throw", "switch", "where", "while",
            "as", "false", "is", "nil", "self", "Self", "super", "throws", "true", "try",
            "async", "await", "some", "any");

    public List<SyntaxToken> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        List<SyntaxToken> tokens = new ArrayList<>();
        int length = text.length();
        int index = 0;
        while (index < length) {
            char ch = text.charAt(index);
            if (Character.isWhitespace(ch)) {
                index++;
                continue;
            }
            int end;
            SyntaxKind kind;
            if (text.startsWith("//", index)) {
                end = lineEnd(text, index);
                kind = text.startsWith("///", index) && !text.startsWith("////", index)
                        ? SyntaxKind.DOC_COMMENT : SyntaxKind.COMMENT;
            } else if (text.startsWith("/*", index)) {
                end = blockCommentEnd(text, index);
                kind = text.startsWith("/**", index) && !text.startsWith("/**/", index)
                        ? SyntaxKind.DOC_COMMENT : SyntaxKind.COMMENT;
            } else if (ch == '#' && rawStringQuoteIndex(text, index) >= 0) {
                end = rawStringEnd(text, index);
                kind = SyntaxKind.STRING;
            } else if (ch == '"') {
                end = text.startsWith("\"\"\"", index) ? multilineStringEnd(text, index) : stringEnd(text, index);
                kind = SyntaxKind.STRING;
            } else if (ch == '`') {
                int close = text.indexOf('`', index + 1);
                int newline = lineEnd(text, index);
                end = close < 0 || close > newline ? index + 1 : close + 1;
                kind = SyntaxKind.IDENTIFIER;
            } else if ((ch == '@' || ch == '#') && index + 1 < length && isIdentifierStart(text.charAt(index + 1))) {
                end = identifierEnd(text, index + 1);
                kind = ch == '@' ? SyntaxKind.ATTRIBUTE : SyntaxKind.POUND_DIRECTIVE;
            } else if (ch == '$' && index + 1 < length && isIdentifierPart(text.charAt(index + 1))) {
                end = identifierEnd(text, index + 1);
                kind = SyntaxKind.IDENTIFIER;
            } else if (Character.isDigit(ch)) {
                end = numberEnd(text, index);
                kind = SyntaxKind.NUMBER;
            } else if (isIdentifierStart(ch)) {
                end = identifierEnd(text, index);
                kind = classifyWord(text, index, end);
            } else {
                index++;
                continue;
            }
            tokens.add(new SyntaxToken(kind, index, end - index));
            index = end;
        }
        return tokens;
    }

    private SyntaxKind classifyWord(String text, int start, int end) {
        String word = text.substring(start, end);
        if (KEYWORDS.contains(word) && !followsMemberAccess(text, start)) {
            return SyntaxKind.KEYWORD;
        }
        return Character.isUpperCase(word.charAt(0)) ? SyntaxKind.TYPE_IDENTIFIER : SyntaxKind.IDENTIFIER;
    }

    // `foo().catch`, `.init`, `value\n    .for` name members, not keywords
    private boolean followsMemberAccess(String text, int start) {
        int previous = start - 1;
        while (previous >= 0 && Character.isWhitespace(text.charAt(previous))) {
            previous--;
        }
        if (previous < 0 || text.charAt(previous) != '.') {
            return false;
        }
        // a `...` or `..<` range operator is not member access
        return previous == 0 || text.charAt(previous - 1) != '.';
    }

    private static int lineEnd(String text, int from) {
        int newline = text.indexOf('\n', from);
        return newline < 0 ? text.length() : newline;
    }

    private static int blockCommentEnd(String text, int start) {
        int depth = 0;
        int index = start;
        while (index < text.length()) {
            if (text.startsWith("/*", index)) {
                depth++;
                index += 2;
            } else if (text.startsWith("*/", index)) {
                depth--;
                index += 2;
                if (depth == 0) {
                    return index;
                }
            } else {
                index++;
            }
        }
        return text.length();
    }

    private static int stringEnd(String text, int start) {
        int index = start + 1;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == '\\') {
                if (index + 1 < text.length() && text.charAt(index + 1) == '(') {
                    index = interpolationEnd(text, index + 1);
                } else {
                    index += 2;
                }
            } else if (ch == '"') {
                return index + 1;
            } else if (ch == '\n') {
                return index;
            } else {
                index++;
            }
        }
        return text.length();
    }

    private static int multilineStringEnd(String text, int start) {
        int index = start + 3;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == '\\') {
                if (index + 1 < text.length() && text.charAt(index + 1) == '(') {
                    index = interpolationEnd(text, index + 1);
                } else {
                    index += 2;
                }
            } else if (text.startsWith("\"\"\"", index)) {
                return index + 3;
            } else {
                index++;
            }
        }
        return text.length();
    }

    /**
     * Skips an interpolation segment starting at its opening paren, including string literals
     * nested inside it.
     */
    private static int interpolationEnd(String text, int openParen) {
        int depth = 0;
        int index = openParen;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return index + 1;
                }
            } else if (ch == '"') {
                index = stringEnd(text, index);
                continue;
            } else if (ch == '\n') {
                return index;
            }
            index++;
        }
        return text.length();
    }

    private static int rawStringQuoteIndex(String text, int start) {
        int index = start;
        while (index < text.length() && text.charAt(index) == '#') {
            index++;
        }
        return index < text.length() && text.charAt(index) == '"' ? index : -1;
    }

    private static int rawStringEnd(String text, int start) {
        int quote = rawStringQuoteIndex(text, start);
        String hashes = text.substring(start, quote);
        boolean multiline = text.startsWith("\"\"\"", quote);
        String terminator = (multiline ? "\"\"\"" : "\"") + hashes;
        int close = text.indexOf(terminator, quote + (multiline ? 3 : 1));
        if (!multiline) {
            int newline = lineEnd(text, quote);
            if (close < 0 || close > newline) {
                return newline;
            }
        }
        return close < 0 ? text.length() : close + terminator.length();
    }

    private static int numberEnd(String text, int start) {
        int index = start;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (Character.isLetterOrDigit(ch) || ch == '_') {
                index++;
            } else if (ch == '.' && index + 1 < text.length() && Character.isDigit(text.charAt(index + 1))) {
                index++;
            } else {
                break;
            }
        }
        return index;
    }

    private static int identifierEnd(String text, int start) {
        int index = start;
        while (index < text.length() && isIdentifierPart(text.charAt(index))) {
            index++;
        }
        return index;
    }

    static boolean isIdentifierStart(char ch) {
        return ch == '_' || Character.isLetter(ch);
    }

    static boolean isIdentifierPart(char ch) {
        return ch == '_' || Character.isLetterOrDigit(ch);
    }
}
