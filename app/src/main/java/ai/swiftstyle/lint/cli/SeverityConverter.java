package ai.swiftstyle.lint.cli;

import ai.swiftstyle.lint.rule.Severity;
import picocli.CommandLine;

/**
 * Parses severity CLI options.
 */
public class SeverityConverter implements CommandLine.ITypeConverter<Severity> {

    @Override
    public Severity convert(String value) {
        return Severity.from(value);
    }
}
