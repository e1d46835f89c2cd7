package ai.swiftstyle.lint.report;

import ai.swiftstyle.lint.rule.Correction;
import ai.swiftstyle.lint.rule.StyleViolation;

/**
 * Renders diagnostics as single lines in the {@code path:line:column} style understood by editors.
 */
public class DiagnosticFormatter {

    public String format(StyleViolation violation) {
        return violation.location() + ": " + violation.severity().label() + ": "
                + violation.rule().consoleDescription();
    }

    public String format(Correction correction) {
        return correction.location() + " Corrected " + correction.rule().name();
    }
}
