package ai.swiftstyle.lint.syntax;

/**
 * Kinds of structural nodes reported by a {@link SyntaxQuery}.
 */
public enum StructureKind {
    CALL,
    IF_STATEMENT,
    FOR_STATEMENT,
    WHILE_STATEMENT,
    REPEAT_STATEMENT,
    GUARD_STATEMENT,
    SWITCH_STATEMENT,
    DO_STATEMENT,
    CATCH_CLAUSE;

    public boolean isStatement() {
        return this != CALL;
    }
}
