package ai.swiftstyle.lint.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives call expressions and control statements from the token stream and bracket layout.
 * This is not a parser: it only recognises the shapes needed to tell statements from calls.
 */
class SwiftStructureBuilder {

    private static final Map<String, StructureKind> STATEMENT_KEYWORDS = Map.of(
            "if", StructureKind.IF_STATEMENT,
            "for", StructureKind.FOR_STATEMENT,
            "while", StructureKind.WHILE_STATEMENT,
            "repeat", StructureKind.REPEAT_STATEMENT,
            "guard", StructureKind.GUARD_STATEMENT,
            "switch", StructureKind.SWITCH_STATEMENT,
            "do", StructureKind.DO_STATEMENT,
            "catch", StructureKind.CATCH_CLAUSE);

    private static final Set<String> CALLABLE_KEYWORDS = Set.of("self", "Self", "super", "init");

    private final String text;
    private final List<SyntaxToken> tokens;
    private final int[] tokenIndexAt;
    private final int[] partner;

    SwiftStructureBuilder(String text, List<SyntaxToken> tokens) {
        this.text = text;
        this.tokens = tokens;
        this.tokenIndexAt = new int[text.length()];
        Arrays.fill(tokenIndexAt, -1);
        for (int i = 0; i < tokens.size(); i++) {
            SyntaxToken token = tokens.get(i);
            Arrays.fill(tokenIndexAt, token.offset(), token.end(), i);
        }
        this.partner = matchBrackets();
    }

    List<StructureNode> build() {
        List<StructureNode> nodes = new ArrayList<>();
        collectCalls(nodes);
        collectStatements(nodes);
        nodes.sort(Comparator.comparingInt(StructureNode::offset)
                .thenComparing(Comparator.comparingInt(StructureNode::length).reversed()));
        return nodes;
    }

    private void collectCalls(List<StructureNode> nodes) {
        for (int open = 1; open < text.length(); open++) {
            if (text.charAt(open) != '(' || !isCode(open) || partner[open] < 0) {
                continue;
            }
            int calleeEnd = open - 1;
            if (!isCallee(calleeEnd)) {
                continue;
            }
            int start = chainStart(calleeEnd);
            int end = trailingClosureEnd(partner[open] + 1);
            nodes.add(new StructureNode(StructureKind.CALL, start, end - start));
        }
    }

    private void collectStatements(List<StructureNode> nodes) {
        for (SyntaxToken token : tokens) {
            if (token.kind() != SyntaxKind.KEYWORD) {
                continue;
            }
            StructureKind kind = STATEMENT_KEYWORDS.get(text.substring(token.offset(), token.end()));
            if (kind == null) {
                continue;
            }
            int bodyOpen = findBodyOpen(token.end());
            int end = bodyOpen < 0 ? token.end() : partner[bodyOpen] + 1;
            nodes.add(new StructureNode(kind, token.offset(), end - token.offset()));
        }
    }

    private boolean isCallee(int index) {
        if (index < 0 || !isCode(index)) {
            return false;
        }
        char ch = text.charAt(index);
        if (ch == ')' || ch == ']') {
            return partner[index] >= 0;
        }
        if (ch == '?' || ch == '!') {
            return isCallee(index - 1);
        }
        int tokenIndex = tokenIndexAt[index];
        if (tokenIndex < 0 || tokens.get(tokenIndex).end() != index + 1) {
            return false;
        }
        SyntaxToken token = tokens.get(tokenIndex);
        return switch (token.kind()) {
            case IDENTIFIER, TYPE_IDENTIFIER -> true;
            case KEYWORD -> CALLABLE_KEYWORDS.contains(text.substring(token.offset(), token.end()));
            default -> false;
        };
    }

    /**
     * Walks back from the last character of a callee over a postfix chain such as
     * {@code foo(a).bar[0]?.baz} and returns the chain's first offset.
     */
    private int chainStart(int calleeEnd) {
        int start = elementStart(calleeEnd);
        while (true) {
            int dot = previousNonWhitespace(start - 1);
            if (dot < 0 || text.charAt(dot) != '.' || !isCode(dot)) {
                return start;
            }
            int previous = previousNonWhitespace(dot - 1);
            if (!isCallee(previous)) {
                return dot;
            }
            start = elementStart(previous);
        }
    }

    private int elementStart(int end) {
        char ch = text.charAt(end);
        if (ch == '?' || ch == '!') {
            return elementStart(end - 1);
        }
        if (ch == ')' || ch == ']') {
            int open = partner[end];
            return isCallee(open - 1) ? elementStart(open - 1) : open;
        }
        return tokens.get(tokenIndexAt[end]).offset();
    }

    private int trailingClosureEnd(int afterArguments) {
        int index = afterArguments;
        while (index < text.length() && (text.charAt(index) == ' ' || text.charAt(index) == '\t')) {
            index++;
        }
        if (index < text.length() && text.charAt(index) == '{' && isCode(index) && partner[index] >= 0) {
            return partner[index] + 1;
        }
        return afterArguments;
    }

    /**
     * Finds the first top-level opening brace after a statement keyword, jumping over bracketed groups.
     * Returns -1 when an enclosing group closes first.
     */
    private int findBodyOpen(int from) {
        int index = from;
        while (index < text.length()) {
            if (!isCode(index)) {
                index++;
                continue;
            }
            char ch = text.charAt(index);
            if (ch == '{') {
                return partner[index] >= 0 ? index : -1;
            }
            if (ch == '(' || ch == '[') {
                if (partner[index] < 0) {
                    return -1;
                }
                index = partner[index] + 1;
                continue;
            }
            if (ch == ')' || ch == ']' || ch == '}') {
                return -1;
            }
            index++;
        }
        return -1;
    }

    private int previousNonWhitespace(int from) {
        int index = from;
        while (index >= 0 && Character.isWhitespace(text.charAt(index))) {
            index--;
        }
        return index;
    }

    private boolean isCode(int index) {
        int tokenIndex = tokenIndexAt[index];
        if (tokenIndex < 0) {
            return true;
        }
        SyntaxKind kind = tokens.get(tokenIndex).kind();
        return kind != SyntaxKind.STRING && !kind.isComment();
    }

    private int[] matchBrackets() {
        int[] result = new int[text.length()];
        Arrays.fill(result, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if ((ch == '(' || ch == '[' || ch == '{') && isCode(i)) {
                stack.push(i);
            } else if ((ch == ')' || ch == ']' || ch == '}') && isCode(i)) {
                if (stack.isEmpty() || !pairs(text.charAt(stack.peek()), ch)) {
                    continue;
                }
                int open = stack.pop();
                result[open] = i;
                result[i] = open;
            }
        }
        return result;
    }

    private static boolean pairs(char open, char close) {
        return (open == '(' && close == ')') || (open == '[' && close == ']') || (open == '{' && close == '}');
    }
}
