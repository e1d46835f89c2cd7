package ai.swiftstyle.lint.config;

/**
 * Whether a run only reports violations or also fixes them in place.
 */
public enum Mode {
    LINT,
    FIX;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return LINT;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean isFix() {
        return this == FIX;
    }
}
