package ai.swiftstyle.lint.rule.controlstatement;

import static org.assertj.core.api.Assertions.assertThat;

import ai.swiftstyle.lint.rule.LintFile;
import ai.swiftstyle.lint.syntax.StructureKind;
import ai.swiftstyle.lint.syntax.SyntaxKind;
import ai.swiftstyle.lint.syntax.SyntaxQuery;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FalsePositiveFilterTest {

    private final FalsePositiveFilter filter = new FalsePositiveFilter();

    @Test
    void acceptsKeywordWithSingleWrappingGroup() {
        LintFile file = fileWith("if (a) {\n", SyntaxKind.KEYWORD, List.of(StructureKind.IF_STATEMENT));

        assertThat(filter.isViolation(onlyMatch(file), file)).isTrue();
    }

    @Test
    void rejectsMatchNotStartingAtKeyword() {
        LintFile file = fileWith("if (a) {\n", SyntaxKind.IDENTIFIER, List.of());

        assertThat(filter.isViolation(onlyMatch(file), file)).isFalse();
    }

    @Test
    void rejectsMatchWhoseInnermostStructureIsCall() {
        LintFile insideCall = fileWith("if (a) {\n", SyntaxKind.KEYWORD,
                List.of(StructureKind.IF_STATEMENT, StructureKind.CALL));
        LintFile statementInsideCall = fileWith("if (a) {\n", SyntaxKind.KEYWORD,
                List.of(StructureKind.CALL, StructureKind.IF_STATEMENT));

        assertThat(filter.isViolation(onlyMatch(insideCall), insideCall)).isFalse();
        assertThat(filter.isViolation(onlyMatch(statementInsideCall), statementInsideCall)).isTrue();
    }

    @Test
    void rejectsClauseMadeOfSeveralGroups() {
        LintFile file = fileWith("if (a || b) && (c || d) {\n", SyntaxKind.KEYWORD, List.of(StructureKind.IF_STATEMENT));

        assertThat(filter.isViolation(onlyMatch(file), file)).isFalse();
    }

    @Test
    void detectsIndependentGroups() {
        assertThat(FalsePositiveFilter.splitsIntoGroups("if (a || b) && (c || d) {")).isTrue();
        assertThat(FalsePositiveFilter.splitsIntoGroups("if (a, b) == (0, 1) {")).isTrue();
        assertThat(FalsePositiveFilter.splitsIntoGroups("if (min...max).contains(value) {")).isTrue();
        assertThat(FalsePositiveFilter.splitsIntoGroups("if ((a || b) && (c || d)) {")).isFalse();
        assertThat(FalsePositiveFilter.splitsIntoGroups("if (max(a, b) < c) {")).isFalse();
        assertThat(FalsePositiveFilter.splitsIntoGroups("if (condition) {")).isFalse();
        assertThat(FalsePositiveFilter.splitsIntoGroups("switch foo {")).isFalse();
    }

    private static ClauseMatch onlyMatch(LintFile file) {
        List<ClauseMatch> matches = new ControlStatementPatterns().scan(file);
        assertThat(matches).hasSize(1);
        return matches.get(0);
    }

    private static LintFile fileWith(String contents, SyntaxKind kind, List<StructureKind> structure) {
        return new LintFile(null, contents, buffer -> new FixedSyntaxQuery(kind, structure));
    }

    private static final class FixedSyntaxQuery implements SyntaxQuery {

        private final SyntaxKind kind;
        private final List<StructureKind> structure;

        FixedSyntaxQuery(SyntaxKind kind, List<StructureKind> structure) {
            this.kind = kind;
            this.structure = structure;
        }

        @Override
        public Optional<SyntaxKind> kindAt(int byteOffset) {
            return Optional.of(kind);
        }

        @Override
        public List<StructureKind> structureKindsAt(int byteOffset) {
            return structure;
        }
    }
}
