package ai.swiftstyle.lint.rule.controlstatement;

import static org.assertj.core.api.Assertions.assertThat;

import ai.swiftstyle.lint.source.SourceBuffer;
import ai.swiftstyle.lint.syntax.SyntaxKind;
import ai.swiftstyle.lint.syntax.SyntaxMatch;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ParenCorrectorTest {

    private final ParenCorrector corrector = new ParenCorrector();

    @Test
    void deletesParenthesesNextToBlanks() {
        CorrectionPlan plan = corrector.correct(new SourceBuffer("if (a) {\n"), List.of(match(ControlKeyword.IF, 0, 8)));

        assertThat(plan.correctedText()).isEqualTo("if a {\n");
        assertThat(plan.recorded()).hasSize(1);
    }

    @Test
    void replacesParenthesesTouchingOtherCharacters() {
        CorrectionPlan plan = corrector.correct(new SourceBuffer("if(a){"), List.of(match(ControlKeyword.IF, 0, 6)));

        assertThat(plan.correctedText()).isEqualTo("if a {");
    }

    @Test
    void correctsSeveralMatchesAndReportsThemInSourceOrder() {
        String text = "if (a) {\n}\nwhile (b) {\n}";
        ClauseMatch first = match(ControlKeyword.IF, 0, 8);
        ClauseMatch second = match(ControlKeyword.WHILE, 11, 11);

        CorrectionPlan plan = corrector.correct(new SourceBuffer(text), List.of(second, first));

        assertThat(plan.correctedText()).isEqualTo("if a {\n}\nwhile b {\n}");
        assertThat(plan.recorded()).containsExactly(first, second);
    }

    @Test
    void removesNestedGroupsWrappingTheWholeClause() {
        CorrectionPlan doubled = corrector.correct(new SourceBuffer("if ((a)) {"), List.of(match(ControlKeyword.IF, 0, 10)));
        CorrectionPlan attached = corrector.correct(new SourceBuffer("while((a || b)) {"),
                List.of(match(ControlKeyword.WHILE, 0, 17)));

        assertThat(doubled.correctedText()).isEqualTo("if a {");
        assertThat(doubled.recorded()).hasSize(1);
        assertThat(attached.correctedText()).isEqualTo("while a || b {");
    }

    @Test
    void keepsInnerGroupsThatDoNotWrapEverything() {
        CorrectionPlan plan = corrector.correct(new SourceBuffer("if ((a) + (b)) {"), List.of(match(ControlKeyword.IF, 0, 16)));

        assertThat(plan.correctedText()).isEqualTo("if (a) + (b) {");
    }

    @Test
    void recordsMatchWithoutBalancedParenthesesButLeavesItAlone() {
        String text = "if ((a) {\nif (b) {\n";
        ClauseMatch broken = match(ControlKeyword.IF, 0, 9);
        ClauseMatch fine = match(ControlKeyword.IF, 10, 8);

        CorrectionPlan plan = corrector.correct(new SourceBuffer(text), List.of(broken, fine));

        assertThat(plan.correctedText()).isEqualTo("if ((a) {\nif b {\n");
        assertThat(plan.recorded()).containsExactly(broken, fine);
    }

    @Test
    void leavesTextAloneWithoutViolations() {
        CorrectionPlan plan = corrector.correct(new SourceBuffer("if a {}"), List.of());

        assertThat(plan.correctedText()).isEqualTo("if a {}");
        assertThat(plan.recorded()).isEmpty();
    }

    private static ClauseMatch match(ControlKeyword keyword, int offset, int length) {
        return new ClauseMatch(keyword, new SyntaxMatch(offset, length, Optional.of(SyntaxKind.KEYWORD)));
    }
}
