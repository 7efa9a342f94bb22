package io.github.drompincen.webdeck.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Checks that the assistant CLI can be started by asking for its version.
 */
public class AssistantCliProbe {

    private static final Logger log = LoggerFactory.getLogger(AssistantCliProbe.class);

    private final ExecutableLocator locator;
    private final String configuredExecutable;
    private final Duration timeout;

    public AssistantCliProbe(ExecutableLocator locator, String configuredExecutable, Duration timeout) {
        this.locator = locator;
        this.configuredExecutable = configuredExecutable;
        this.timeout = timeout;
    }

    public Optional<String> probeVersion() {
        String executable = locator.resolve(configuredExecutable);
        Process process;
        try {
            process = new ProcessBuilder(executable, "--version").redirectErrorStream(true).start();
        } catch (IOException e) {
            log.warn("Assistant CLI '{}' could not be started: {}", executable, e.getMessage());
            return Optional.empty();
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Assistant CLI '{}' did not answer --version within {}", executable, timeout);
                return Optional.empty();
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0) {
                log.warn("Assistant CLI '{}' --version exited with {}: {}", executable, process.exitValue(), output);
                return Optional.empty();
            }
            String version = output.lines().findFirst().orElse("");
            log.info("Assistant CLI found at {}: {}", executable, version);
            return Optional.of(version);
        } catch (IOException e) {
            log.warn("Failed to read assistant CLI version: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return Optional.empty();
        }
    }
}
