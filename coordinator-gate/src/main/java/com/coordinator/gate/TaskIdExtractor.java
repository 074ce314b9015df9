package com.coordinator.gate;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the task a commit message refers to.
 *
 * Patterns are tried in order and the first match wins, so an explicit tag such as
 * {@code fix(PRP-7): ...} is preferred over an id that merely appears in the text.
 */
public class TaskIdExtractor {

    static final String ID = "[A-Z][A-Z0-9]*-[0-9]+(?:-[0-9]+)*";

    /** {@code type(ID):} conventional-commit scope. */
    static final Pattern SCOPED = Pattern.compile("^\\s*[A-Za-z]+(?:!)?\\((" + ID + ")\\)!?:");
    /** {@code [ID]} tag anywhere in the subject line. */
    static final Pattern BRACKETED = Pattern.compile("\\[(" + ID + ")\\]");
    /** {@code ID:} prefix of the subject line. */
    static final Pattern PREFIXED = Pattern.compile("^\\s*(" + ID + "):");
    /** Id anywhere in the message. */
    static final Pattern BARE = Pattern.compile("(?<![A-Za-z0-9-])(" + ID + ")(?![A-Za-z0-9-])");

    /**
     * A task id and whether it came from an explicit tag.
     */
    public record Match(String taskId, boolean tagged) {
    }

    private final List<Pattern> taggedPatterns;
    private final Pattern barePattern;

    public TaskIdExtractor() {
        this(List.of(SCOPED, BRACKETED, PREFIXED), BARE);
    }

    public TaskIdExtractor(List<Pattern> taggedPatterns, Pattern barePattern) {
        this.taggedPatterns = List.copyOf(taggedPatterns);
        this.barePattern = barePattern;
    }

    public Optional<Match> extract(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String subject = message.lines().findFirst().orElse("");
        for (Pattern pattern : taggedPatterns) {
            Matcher matcher = pattern.matcher(subject);
            if (matcher.find()) {
                return Optional.of(new Match(matcher.group(1), true));
            }
        }
        if (barePattern != null) {
            Matcher matcher = barePattern.matcher(message);
            if (matcher.find()) {
                return Optional.of(new Match(matcher.group(1), false));
            }
        }
        return Optional.empty();
    }
}
