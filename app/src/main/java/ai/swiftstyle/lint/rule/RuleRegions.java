package ai.swiftstyle.lint.rule;

import ai.swiftstyle.lint.source.SourceBuffer;
import ai.swiftstyle.lint.syntax.SyntaxKind;
import ai.swiftstyle.lint.syntax.SyntaxQuery;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Enabled/disabled state of rules derived from {@code swiftlint:disable} and
 * {@code swiftlint:enable} commands written in comments.
 */
public final class RuleRegions {

    static final String ALL_RULES = "all";

    private static final Pattern COMMAND_PATTERN = Pattern.compile(
            "swiftlint:(enable|disable)(?::(next|this|previous))?((?:[ \\t]+[A-Za-z0-9_.]+)+)");

    private final SourceBuffer buffer;
    private final List<Command> commands;

    private RuleRegions(SourceBuffer buffer, List<Command> commands) {
        this.buffer = buffer;
        this.commands = List.copyOf(commands);
    }

    public static RuleRegions parse(SourceBuffer buffer, SyntaxQuery syntax) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(syntax, "syntax");
        List<Command> commands = new ArrayList<>();
        Matcher matcher = COMMAND_PATTERN.matcher(buffer.text());
        while (matcher.find()) {
            boolean inComment = syntax.kindAt(buffer.byteOffset(matcher.start()))
                    .filter(SyntaxKind::isComment)
                    .isPresent();
            if (!inComment) {
                continue;
            }
            Set<String> ruleIds = Arrays.stream(matcher.group(3).trim().split("\\s+"))
                    .collect(Collectors.toUnmodifiableSet());
            Modifier modifier = matcher.group(2) == null
                    ? Modifier.NONE
                    : Modifier.valueOf(matcher.group(2).toUpperCase(Locale.ROOT));
            commands.add(new Command("enable".equals(matcher.group(1)), modifier, ruleIds,
                    matcher.start(), buffer.locate(matcher.start()).line()));
        }
        return new RuleRegions(buffer, commands);
    }

    public boolean isEnabled(String ruleIdentifier, int characterOffset) {
        if (commands.isEmpty()) {
            return true;
        }
        int line = buffer.locate(characterOffset).line();
        boolean enabled = true;
        for (Command command : commands) {
            if (command.modifier() == Modifier.NONE && command.offset() < characterOffset && command.appliesTo(ruleIdentifier)) {
                enabled = command.enable();
            }
        }
        for (Command command : commands) {
            if (command.modifier() != Modifier.NONE && command.targetLine() == line && command.appliesTo(ruleIdentifier)) {
                enabled = command.enable();
            }
        }
        return enabled;
    }

    int commandCount() {
        return commands.size();
    }

    private enum Modifier {
        NONE,
        NEXT,
        THIS,
        PREVIOUS
    }

    private record Command(boolean enable, Modifier modifier, Set<String> ruleIds, int offset, int line) {

        boolean appliesTo(String ruleIdentifier) {
            return ruleIds.contains(ruleIdentifier) || ruleIds.contains(ALL_RULES);
        }

        int targetLine() {
            return switch (modifier) {
                case NEXT -> line + 1;
                case PREVIOUS -> line - 1;
                case THIS, NONE -> line;
            };
        }
    }
}
