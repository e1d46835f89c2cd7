package ai.swiftstyle.lint.rule.controlstatement;

import ai.swiftstyle.lint.rule.CorrectableRule;
import ai.swiftstyle.lint.rule.Correction;
import ai.swiftstyle.lint.rule.LintFile;
import ai.swiftstyle.lint.rule.Location;
import ai.swiftstyle.lint.rule.RuleDescription;
import ai.swiftstyle.lint.rule.RuleKind;
import ai.swiftstyle.lint.rule.Severity;
import ai.swiftstyle.lint.rule.StyleViolation;
import ai.swiftstyle.lint.source.SourceBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags {@code if}, {@code for}, {@code guard}, {@code switch}, {@code while} and {@code catch}
 * clauses wrapped in parentheses they do not need, and removes those parentheses on correction.
 */
public final class ControlStatementRule implements CorrectableRule {

    private static final Logger LOGGER = LoggerFactory.getLogger(ControlStatementRule.class);

    public static final RuleDescription DESCRIPTION = new RuleDescription(
            "control_statement",
            "Control Statement",
            "`if`, `for`, `guard`, `switch`, `while`, and `catch` statements shouldn't unnecessarily wrap their "
                    + "conditionals or arguments in parentheses.",
            RuleKind.STYLE,
            List.of(
                    "if condition {\n",
                    "if (a, b) == (0, 1) {\n",
                    "if (a || b) && (c || d) {\n",
                    "if (min...max).contains(value) {\n",
                    "if renderGif(data) {\n",
                    "renderGif(data)\n",
                    "for item in collection {\n",
                    "for (key, value) in dictionary {\n",
                    "for (index, value) in enumerate(array) {\n",
                    "for var index = 0; index < 42; index++ {\n",
                    "guard condition else {\n",
                    "while condition {\n",
                    "} while condition {\n",
                    "do { ; } while condition {\n",
                    "switch foo {\n",
                    "do {\n} catch let error as NSError {\n}",
                    "foo().catch(all: true) {}",
                    "if max(a, b) < c {\n",
                    "switch (lhs, rhs) {\n"),
            List.of(
                    "↓if (condition) {\n",
                    "↓if(condition) {\n",
                    "↓if (condition == endIndex) {\n",
                    "↓if ((a || b) && (c || d)) {\n",
                    "↓if ((min...max).contains(value)) {\n",
                    "↓for (item in collection) {\n",
                    "↓for (var index = 0; index < 42; index++) {\n",
                    "↓for(item in collection) {\n",
                    "↓for(var index = 0; index < 42; index++) {\n",
                    "↓guard (condition) else {\n",
                    "↓while (condition) {\n",
                    "↓while(condition) {\n",
                    "} ↓while (condition) {\n",
                    "} ↓while(condition) {\n",
                    "do { ; } ↓while(condition) {\n",
                    "do { ; } ↓while (condition) {\n",
                    "↓switch (foo) {\n",
                    "do {\n} ↓catch(let error as NSError) {\n}",
                    "↓if (max(a, b) < c) {\n"),
            corrections());

    private final Severity severity;
    private final ControlStatementPatterns patterns;
    private final FalsePositiveFilter filter;
    private final ParenCorrector corrector;

    public ControlStatementRule() {
        this(Severity.WARNING);
    }

    public ControlStatementRule(Severity severity) {
        this(severity, new ControlStatementPatterns(), new FalsePositiveFilter(), new ParenCorrector());
    }

    ControlStatementRule(Severity severity,
                         ControlStatementPatterns patterns,
                         FalsePositiveFilter filter,
                         ParenCorrector corrector) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.corrector = Objects.requireNonNull(corrector, "corrector");
    }

    @Override
    public RuleDescription description() {
        return DESCRIPTION;
    }

    public Severity severity() {
        return severity;
    }

    @Override
    public List<StyleViolation> validate(LintFile file) {
        return violatingMatches(file).stream()
                .map(match -> new StyleViolation(DESCRIPTION, severity, file.location(match.offset())))
                .collect(Collectors.toList());
    }

    @Override
    public List<Correction> correct(LintFile file) {
        List<ClauseMatch> violations = violatingMatches(file);
        if (violations.isEmpty()) {
            return List.of();
        }
        SourceBuffer original = file.buffer();
        Path path = file.path().orElse(null);
        CorrectionPlan plan = corrector.correct(original, violations);
        if (!plan.correctedText().equals(original.text())) {
            file.write(plan.correctedText());
        }
        List<Correction> corrections = new ArrayList<>(plan.recorded().size());
        for (ClauseMatch match : plan.recorded()) {
            corrections.add(new Correction(DESCRIPTION, Location.of(path, original, match.offset())));
        }
        LOGGER.debug("Corrected {} control statement violations in {}", corrections.size(),
                path == null ? "<nopath>" : path);
        return corrections;
    }

    private List<ClauseMatch> violatingMatches(LintFile file) {
        Objects.requireNonNull(file, "file");
        return patterns.scan(file).stream()
                .filter(match -> filter.isViolation(match, file))
                .filter(match -> file.isRuleEnabled(DESCRIPTION.identifier(), match.offset()))
                .sorted(Comparator.comparingInt(ClauseMatch::offset))
                .collect(Collectors.toList());
    }

    private static Map<String, String> corrections() {
        Map<String, String> corrections = new LinkedHashMap<>();
        corrections.put("↓if (condition) {\n", "if condition {\n");
        corrections.put("↓if(condition) {\n", "if condition {\n");
        corrections.put("↓if (condition == endIndex) {\n", "if condition == endIndex {\n");
        corrections.put("↓if ((a || b) && (c || d)) {\n", "if (a || b) && (c || d) {\n");
        corrections.put("↓if ((min...max).contains(value)) {\n", "if (min...max).contains(value) {\n");
        corrections.put("↓for (item in collection) {\n", "for item in collection {\n");
        corrections.put("↓for (var index = 0; index < 42; index++) {\n", "for var index = 0; index < 42; index++ {\n");
        corrections.put("↓for(item in collection) {\n", "for item in collection {\n");
        corrections.put("↓for(var index = 0; index < 42; index++) {\n", "for var index = 0; index < 42; index++ {\n");
        corrections.put("↓guard (condition) else {\n", "guard condition else {\n");
        corrections.put("↓while (condition) {\n", "while condition {\n");
        corrections.put("↓while(condition) {\n", "while condition {\n");
        corrections.put("} ↓while (condition) {\n", "} while condition {\n");
        corrections.put("} ↓while(condition) {\n", "} while condition {\n");
        corrections.put("do { ; } ↓while(condition) {\n", "do { ; } while condition {\n");
        corrections.put("do { ; } ↓while (condition) {\n", "do { ; } while condition {\n");
        corrections.put("↓switch (foo) {\n", "switch foo {\n");
        corrections.put("do {\n} ↓catch(let error as NSError) {\n}", "do {\n} catch let error as NSError {\n}");
        corrections.put("↓if (max(a, b) < c) {\n", "if max(a, b) < c {\n");
        return corrections;
    }
}
