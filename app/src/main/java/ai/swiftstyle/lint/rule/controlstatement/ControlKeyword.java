package ai.swiftstyle.lint.rule.controlstatement;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Control statements whose clause must not be wrapped in redundant parentheses.
 */
public enum ControlKeyword {
    IF,
    FOR,
    GUARD,
    SWITCH,
    WHILE,
    CATCH;

    private final String spelling;
    private final Pattern pattern;

    ControlKeyword() {
        this.spelling = name().toLowerCase(Locale.ROOT);
        this.pattern = Pattern.compile(buildPattern());
    }

    public String spelling() {
        return spelling;
    }

    /**
     * Keyword, parenthesised clause, then the opening brace of the body. {@code guard} also needs
     * its {@code else}; a {@code switch} subject may not contain a comma so tuple subjects never match.
     */
    public Pattern pattern() {
        return pattern;
    }

    private String buildPattern() {
        String elsePattern = "guard".equals(spelling) ? "else\\s*" : "";
        String clausePattern = "switch".equals(spelling) ? "[^,{]*" : "[^{]*";
        return spelling + "\\s*\\(" + clausePattern + "\\)\\s*" + elsePattern + "\\{";
    }
}
