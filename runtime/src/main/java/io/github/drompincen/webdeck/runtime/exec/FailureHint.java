package io.github.drompincen.webdeck.runtime.exec;

import java.util.List;

public record FailureHint(
        String headline,
        List<String> solutions,
        FailureKind kind
) {}
