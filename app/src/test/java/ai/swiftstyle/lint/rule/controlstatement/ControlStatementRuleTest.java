package ai.swiftstyle.lint.rule.controlstatement;

import static org.assertj.core.api.Assertions.assertThat;

import ai.swiftstyle.lint.rule.Correction;
import ai.swiftstyle.lint.rule.LintFile;
import ai.swiftstyle.lint.rule.Severity;
import ai.swiftstyle.lint.rule.StyleViolation;
import ai.swiftstyle.lint.syntax.SwiftSyntaxService;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ControlStatementRuleTest {

    private final ControlStatementRule rule = new ControlStatementRule();

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "if (ready) {|if ready {",
            "if(ready) {|if ready {",
            "for (item in items) {|for item in items {",
            "for(item in items) {|for item in items {",
            "guard (ready) else {|guard ready else {",
            "guard(ready) else {|guard ready else {",
            "switch (value) {|switch value {",
            "switch(value) {|switch value {",
            "while (ready) {|while ready {",
            "while(ready) {|while ready {"
    })
    void flagsAndCorrectsEveryKeyword(String statement, String expected) {
        String source = "func run() {\n    " + statement + "\n    }\n}\n";

        List<StyleViolation> violations = rule.validate(LintFile.of(source));
        LintFile file = LintFile.of(source);
        List<Correction> corrections = rule.correct(file);

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).location().line()).isEqualTo(2);
        assertThat(violations.get(0).location().column()).isEqualTo(5);
        assertThat(corrections).hasSize(1);
        assertThat(file.contents()).isEqualTo("func run() {\n    " + expected + "\n    }\n}\n");
    }

    @Test
    void flagsCatchClauseButNotCatchMember() {
        String clause = "do {\n    try work()\n} catch (let error) {\n}\n";
        String member = "promise.catch(on: queue) {\n}\n";

        assertThat(rule.validate(LintFile.of(clause))).hasSize(1);
        assertThat(rule.validate(LintFile.of(member))).isEmpty();
    }

    @Test
    void correctionIsIdempotent() {
        LintFile file = LintFile.of("if (a) {\n    while(b) {\n    }\n}\n");

        List<Correction> first = rule.correct(file);
        String corrected = file.contents();
        List<Correction> second = rule.correct(file);

        assertThat(first).hasSize(2);
        assertThat(corrected).isEqualTo("if a {\n    while b {\n    }\n}\n");
        assertThat(second).isEmpty();
        assertThat(file.contents()).isEqualTo(corrected);
        assertThat(rule.validate(file)).isEmpty();
    }

    @Test
    void nestedWrappingGroupsAreRemovedInOnePass() {
        String source = "if ((a)) {\n    while ((a || b)) {\n    }\n}\n";
        LintFile file = LintFile.of(source);

        List<Correction> first = rule.correct(file);
        String corrected = file.contents();
        List<Correction> second = rule.correct(file);

        assertThat(first).extracting(correction -> correction.location().characterOffset())
                .containsExactly(0, source.indexOf("while"));
        assertThat(corrected).isEqualTo("if a {\n    while a || b {\n    }\n}\n");
        assertThat(second).isEmpty();
        assertThat(file.contents()).isEqualTo(corrected);
    }

    @Test
    void correctionCountMatchesViolationCountInSourceOrder() {
        String source = "if (a) { if (b) { } }\n"
                + "for (x in xs) {\n}\n"
                + "switch (mode) {\ndefault: break\n}\n"
                + "if (a || b) && (c || d) {\n}\n";

        List<StyleViolation> violations = rule.validate(LintFile.of(source));
        LintFile file = LintFile.of(source);
        List<Correction> corrections = rule.correct(file);

        assertThat(violations).hasSize(4);
        assertThat(corrections).hasSameSizeAs(violations);
        assertThat(corrections)
                .extracting(correction -> correction.location().characterOffset())
                .containsExactlyElementsOf(violations.stream()
                        .map(violation -> violation.location().characterOffset())
                        .collect(Collectors.toList()))
                .isSorted();
        assertThat(file.contents()).isEqualTo("if a { if b { } }\n"
                + "for x in xs {\n}\n"
                + "switch mode {\ndefault: break\n}\n"
                + "if (a || b) && (c || d) {\n}\n");
    }

    @Test
    void ignoresCodeInStringsAndComments() {
        String source = "let s = \"if (a) {\"\n// while (b) {\n/* for (x in y) { */\n";

        assertThat(rule.validate(LintFile.of(source))).isEmpty();
    }

    @Test
    void ignoresKeywordsEmbeddedInIdentifiers() {
        assertThat(rule.validate(LintFile.of("notif (x) {\n}\n"))).isEmpty();
        assertThat(rule.validate(LintFile.of("if renderGif(data) {\n}\n"))).isEmpty();
    }

    @Test
    void statementInsideTrailingClosureIsStillFlagged() {
        String source = "run(queue) {\n    if (ready) {\n    }\n}\n";

        List<StyleViolation> violations = rule.validate(LintFile.of(source));

        assertThat(violations).extracting(violation -> violation.location().characterOffset())
                .containsExactly(source.indexOf("if"));
    }

    @Test
    void unbalancedClauseIsRecordedButLeftUncorrected() {
        String source = "if ((a) {\n}\nif (b) {\n}\n";
        LintFile file = LintFile.of(source);

        List<StyleViolation> violations = rule.validate(LintFile.of(source));
        List<Correction> corrections = rule.correct(file);

        assertThat(violations).hasSize(2);
        assertThat(corrections).hasSameSizeAs(violations);
        assertThat(corrections).extracting(correction -> correction.location().line()).containsExactly(1, 3);
        assertThat(file.contents()).isEqualTo("if ((a) {\n}\nif b {\n}\n");
    }

    @Test
    void respectsDisableComments() {
        String source = "// swiftlint:disable:next control_statement\n"
                + "if (a) {\n}\n"
                + "if (b) {\n}\n";
        LintFile file = LintFile.of(source);

        List<StyleViolation> violations = rule.validate(LintFile.of(source));
        List<Correction> corrections = rule.correct(file);

        assertThat(violations).extracting(violation -> violation.location().line()).containsExactly(4);
        assertThat(corrections).hasSize(1);
        assertThat(file.contents()).contains("if (a) {").contains("if b {");
    }

    @Test
    void reportsConfiguredSeverity() {
        List<StyleViolation> violations = new ControlStatementRule(Severity.ERROR).validate(LintFile.of("if (a) {\n}\n"));

        assertThat(violations).singleElement()
                .satisfies(violation -> {
                    assertThat(violation.severity()).isEqualTo(Severity.ERROR);
                    assertThat(violation.isSerious()).isTrue();
                    assertThat(violation.rule().identifier()).isEqualTo("control_statement");
                });
    }

    @Test
    void writesFileOnlyWhenContentsChange() throws Exception {
        Path clean = tempDir.resolve("Clean.swift");
        Path dirty = tempDir.resolve("Dirty.swift");
        Files.writeString(clean, "if a {\n}\n", StandardCharsets.UTF_8);
        Files.writeString(dirty, "if (a) {\n}\n", StandardCharsets.UTF_8);
        RecordingLintFile cleanFile = new RecordingLintFile(clean, Files.readString(clean));
        RecordingLintFile dirtyFile = new RecordingLintFile(dirty, Files.readString(dirty));

        rule.correct(cleanFile);
        List<Correction> corrections = rule.correct(dirtyFile);

        assertThat(cleanFile.writes).isZero();
        assertThat(dirtyFile.writes).isEqualTo(1);
        assertThat(Files.readString(dirty, StandardCharsets.UTF_8)).isEqualTo("if a {\n}\n");
        assertThat(corrections).singleElement()
                .satisfies(correction -> assertThat(correction.location()).hasToString(dirty + ":1:1"));
    }

    private static final class RecordingLintFile extends LintFile {

        private int writes;

        RecordingLintFile(Path path, String contents) {
            super(path, contents, SwiftSyntaxService::new);
        }

        @Override
        public void write(String contents) {
            writes++;
            super.write(contents);
        }
    }
}
