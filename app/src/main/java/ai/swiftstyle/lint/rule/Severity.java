package ai.swiftstyle.lint.rule;

import java.util.Locale;

/**
 * Severity attached to reported violations.
 */
public enum Severity {
    WARNING,
    ERROR;

    public static Severity from(String raw) {
        if (raw == null || raw.isBlank()) {
            return WARNING;
        }
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(raw.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unsupported severity: " + raw);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
