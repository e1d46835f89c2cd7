package ai.swiftstyle.lint.rule.controlstatement;

import java.util.List;
import java.util.Objects;

/**
 * Corrected text and the violations it accounts for, in document order. A violation whose
 * parentheses could not be located is recorded without an edit.
 */
public record CorrectionPlan(String correctedText, List<ClauseMatch> recorded) {

    public CorrectionPlan {
        Objects.requireNonNull(correctedText, "correctedText");
        recorded = List.copyOf(Objects.requireNonNull(recorded, "recorded"));
    }
}
