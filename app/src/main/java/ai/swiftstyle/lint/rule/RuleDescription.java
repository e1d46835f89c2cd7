package ai.swiftstyle.lint.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static metadata of a rule together with the examples it is verified against.
 *
 * <p>Triggering examples and correction inputs mark each expected violation start with
 * {@link #VIOLATION_MARKER}.
 */
public record RuleDescription(String identifier,
                              String name,
                              String description,
                              RuleKind kind,
                              List<String> nonTriggeringExamples,
                              List<String> triggeringExamples,
                              Map<String, String> corrections) {

    public static final String VIOLATION_MARKER = "↓";

    public RuleDescription {
        identifier = requireNonBlank(identifier, "identifier");
        name = requireNonBlank(name, "name");
        description = requireNonBlank(description, "description");
        Objects.requireNonNull(kind, "kind");
        nonTriggeringExamples = nonTriggeringExamples == null ? List.of() : List.copyOf(nonTriggeringExamples);
        triggeringExamples = triggeringExamples == null ? List.of() : List.copyOf(triggeringExamples);
        corrections = corrections == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(corrections));
    }

    public String consoleDescription() {
        return name + " Violation: " + description + " (" + identifier + ")";
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
