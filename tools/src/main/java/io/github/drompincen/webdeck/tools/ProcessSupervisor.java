package io.github.drompincen.webdeck.tools;

import io.github.drompincen.webdeck.runtime.exec.ExecutionContext;
import io.github.drompincen.webdeck.runtime.exec.ExecutionFailureException;
import io.github.drompincen.webdeck.runtime.exec.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Owns a child process for the duration of one request: pumps its output on reader
 * threads, stops the process tree when the request is cancelled and escalates to a
 * forced kill after the grace period. Children get no stdin, and background processes
 * they leave behind are stopped once the request ends.
 */
final class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    static final long POLL_MILLIS = 100;
    static final long READER_JOIN_MILLIS = 1000;

    private final Process process;
    private final ExecutionContext context;
    private final Duration killGrace;
    private final List<Thread> readers = new ArrayList<>();
    // sampled while the process runs; orphans are reparented once it exits
    private final Set<ProcessHandle> seenDescendants = new LinkedHashSet<>();
    private volatile long stopRequestedAt;

    private ProcessSupervisor(Process process, ExecutionContext context, Duration killGrace) {
        this.process = process;
        this.context = context;
        this.killGrace = killGrace;
    }

    static ProcessSupervisor start(ProcessBuilder builder, ExecutionContext context, Duration killGrace) throws IOException {
        builder.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        Process process = builder.start();
        ProcessSupervisor supervisor = new ProcessSupervisor(process, context, killGrace);
        log.debug("Request {}: started pid {}: {}", context.requestId(), process.pid(), builder.command());
        context.token().onCancel(supervisor::stop);
        return supervisor;
    }

    InputStream stdout() { return process.getInputStream(); }

    InputStream stderr() { return process.getErrorStream(); }

    /** Forwards output as it arrives, without waiting for line ends. */
    void pumpChunks(InputStream in, String channel, Consumer<String> consumer) {
        startReader(channel, () -> {
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                char[] buffer = new char[4096];
                int n;
                while ((n = reader.read(buffer)) != -1) {
                    consumer.accept(new String(buffer, 0, n));
                }
            }
        });
    }

    void pumpLines(InputStream in, String channel, Consumer<String> consumer) {
        startReader(channel, () -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    consumer.accept(line);
                }
            }
        });
    }

    /**
     * Blocks until the process exits and its output has been drained.
     *
     * @throws ExecutionFailureException with {@link FailureKind#CANCELLED} if the request was cancelled
     */
    int waitForExit() {
        boolean forced = false;
        try {
            trackDescendants();
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                trackDescendants();
                long stoppedAt = stopRequestedAt;
                if (stoppedAt == 0) {
                    continue;
                }
                long elapsed = System.currentTimeMillis() - stoppedAt;
                if (!forced && elapsed >= killGrace.toMillis()) {
                    log.info("Request {}: process {} ignored stop, killing", context.requestId(), process.pid());
                    forceKill();
                    forced = true;
                } else if (forced && elapsed >= 2 * killGrace.toMillis() + READER_JOIN_MILLIS) {
                    log.warn("Request {}: process {} survived a forced kill, no longer waiting",
                            context.requestId(), process.pid());
                    break;
                }
            }
            stopLeftovers();
            joinReaders();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forceKill();
            throw new ExecutionFailureException(FailureKind.RUNTIME, "Interrupted while waiting for the process", e);
        }
        if (context.isCancelled()) {
            throw ExecutionFailureException.cancelled();
        }
        return process.exitValue();
    }

    private void stop() {
        stopRequestedAt = System.currentTimeMillis();
        log.debug("Request {}: stopping process tree of pid {}", context.requestId(), process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    static File nullDevice() {
        return new File(Platform.isWindows() ? "NUL" : "/dev/null");
    }

    private void trackDescendants() {
        process.descendants().forEach(seenDescendants::add);
    }

    private void stopLeftovers() {
        process.descendants().forEach(seenDescendants::add);
        long left = seenDescendants.stream().filter(ProcessHandle::isAlive).count();
        if (left == 0) {
            return;
        }
        log.debug("Request {}: stopping {} background processes left by pid {}",
                context.requestId(), left, process.pid());
        seenDescendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroy);
    }

    private void forceKill() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private void joinReaders() throws InterruptedException {
        for (Thread reader : readers) {
            reader.join(READER_JOIN_MILLIS);
            if (reader.isAlive()) {
                log.debug("Request {}: reader {} still open after exit", context.requestId(), reader.getName());
            }
        }
    }

    private void startReader(String channel, IoTask task) {
        Thread reader = new Thread(() -> {
            try {
                task.run();
            } catch (IOException e) {
                if (context.isCancelled() || !process.isAlive()) {
                    log.debug("Request {}: {} closed: {}", context.requestId(), channel, e.getMessage());
                } else {
                    log.warn("Request {}: error reading {}: {}", context.requestId(), channel, e.getMessage());
                }
            }
        }, "webdeck-" + context.requestId() + "-" + channel);
        reader.setDaemon(true);
        readers.add(reader);
        reader.start();
    }

    @FunctionalInterface
    private interface IoTask {
        void run() throws IOException;
    }
}
