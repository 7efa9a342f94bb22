package io.github.drompincen.webdeck.runtime.exec;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @Test
    void missingApiKeyIsConfigurationFailure() {
        FailureHint hint = FailureClassifier.classify("Error: ANTHROPIC_API_KEY environment variable not set");

        assertThat(hint.headline()).isEqualTo("Claude Code API key is not configured.");
        assertThat(hint.kind()).isEqualTo(FailureKind.CONFIGURATION);
    }

    @Test
    void rulesAreCheckedInOrder() {
        // mentions both the key and authentication; the key rule comes first
        FailureHint hint = FailureClassifier.classify("authentication failed: ANTHROPIC_API_KEY invalid");

        assertThat(hint.headline()).isEqualTo("Claude Code API key is not configured.");
    }

    @Test
    void recognisesEachKnownFailure() {
        assertThat(FailureClassifier.classify("429 rate limit reached").headline())
                .isEqualTo("Claude API rate limit exceeded.");
        assertThat(FailureClassifier.classify("HTTP 401 Unauthorized").headline())
                .isEqualTo("Claude API authentication failed.");
        assertThat(FailureClassifier.classify("monthly quota used up").headline())
                .isEqualTo("Claude API quota exceeded.");
        assertThat(FailureClassifier.classify("Invalid request: bad tool name").headline())
                .isEqualTo("Invalid request sent to Claude.");
    }

    @Test
    void unknownFailureGetsGenericHeadline() {
        FailureHint hint = FailureClassifier.classify("segmentation fault");

        assertThat(hint.headline()).isEqualTo("Claude Code process exited unexpectedly.");
        assertThat(hint.kind()).isEqualTo(FailureKind.RUNTIME);
    }

    @Test
    void nullInputIsGeneric() {
        assertThat(FailureClassifier.classify(null).headline())
                .isEqualTo("Claude Code process exited unexpectedly.");
    }

    @Test
    void describeIncludesSolutionsAndTruncatedDebugInfo() {
        String raw = "quota " + "x".repeat(500);

        String message = FailureClassifier.describe(raw);

        assertThat(message).startsWith("Claude API quota exceeded.\n\nPossible solutions:\n• ");
        String debug = message.substring(message.indexOf("Debug info: ") + "Debug info: ".length());
        assertThat(debug).hasSize(FailureClassifier.DEBUG_DETAIL_LIMIT);
        assertThat(debug).startsWith("quota xxx");
    }

    @Test
    void toFailureCarriesClassifiedKind() {
        ExecutionFailureException failure = FailureClassifier.toFailure("ANTHROPIC_API_KEY missing");

        assertThat(failure.kind()).isEqualTo(FailureKind.CONFIGURATION);
        assertThat(failure.getMessage()).contains("Debug info: ANTHROPIC_API_KEY missing");
    }
}
