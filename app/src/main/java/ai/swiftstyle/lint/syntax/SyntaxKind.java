package ai.swiftstyle.lint.syntax;

/**
 * Coarse classification of a source token.
 */
public enum SyntaxKind {
    KEYWORD,
    IDENTIFIER,
    TYPE_IDENTIFIER,
    NUMBER,
    STRING,
    COMMENT,
    DOC_COMMENT,
    ATTRIBUTE,
    POUND_DIRECTIVE;

    public boolean isComment() {
        return this == COMMENT || this == DOC_COMMENT;
    }
}
