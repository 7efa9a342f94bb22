package io.github.drompincen.webdeck.runtime.exec;

import java.util.List;
import java.util.Locale;

/**
 * Turns raw assistant CLI failure output into an actionable message. The rule table is
 * checked in order and the first match wins.
 */
public final class FailureClassifier {

    static final int DEBUG_DETAIL_LIMIT = 300;

    private static final List<Rule> RULES = List.of(
            new Rule(List.of("ANTHROPIC_API_KEY"), new FailureHint(
                    "Claude Code API key is not configured.",
                    List.of("Set your API key: export ANTHROPIC_API_KEY=\"your-api-key\"",
                            "Or log in to the Claude CLI once so it can use its stored credentials"),
                    FailureKind.CONFIGURATION)),
            new Rule(List.of("rate limit"), new FailureHint(
                    "Claude API rate limit exceeded.",
                    List.of("Wait a few minutes before retrying",
                            "Check your plan's rate limits"),
                    FailureKind.CONFIGURATION)),
            new Rule(List.of("authentication", "401"), new FailureHint(
                    "Claude API authentication failed.",
                    List.of("Check that your API key is valid",
                            "Re-authenticate the Claude CLI"),
                    FailureKind.CONFIGURATION)),
            new Rule(List.of("quota"), new FailureHint(
                    "Claude API quota exceeded.",
                    List.of("Check your usage and billing settings",
                            "Wait for the quota to reset"),
                    FailureKind.CONFIGURATION)),
            new Rule(List.of("Invalid request"), new FailureHint(
                    "Invalid request sent to Claude.",
                    List.of("Try a shorter or simpler message",
                            "Check the allowed tools and session id"),
                    FailureKind.RUNTIME)));

    private static final FailureHint GENERIC = new FailureHint(
            "Claude Code process exited unexpectedly.",
            List.of("Check that the Claude CLI is installed and on the PATH",
                    "Run 'claude --version' in a terminal to verify the installation",
                    "Check the server logs for details"),
            FailureKind.RUNTIME);

    private FailureClassifier() {}

    public static FailureHint classify(String raw) {
        String haystack = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            for (String needle : rule.needles()) {
                if (haystack.contains(needle.toLowerCase(Locale.ROOT))) {
                    return rule.hint();
                }
            }
        }
        return GENERIC;
    }

    public static String describe(String raw) {
        FailureHint hint = classify(raw);
        StringBuilder sb = new StringBuilder(hint.headline());
        sb.append("\n\nPossible solutions:");
        for (String solution : hint.solutions()) {
            sb.append("\n• ").append(solution);
        }
        String detail = raw == null ? "" : raw.strip();
        if (detail.length() > DEBUG_DETAIL_LIMIT) {
            detail = detail.substring(0, DEBUG_DETAIL_LIMIT);
        }
        sb.append("\n\nDebug info: ").append(detail);
        return sb.toString();
    }

    /** Wraps {@code raw} into an exception carrying the classified message and kind. */
    public static ExecutionFailureException toFailure(String raw) {
        return new ExecutionFailureException(classify(raw).kind(), describe(raw));
    }

    private record Rule(List<String> needles, FailureHint hint) {}
}
