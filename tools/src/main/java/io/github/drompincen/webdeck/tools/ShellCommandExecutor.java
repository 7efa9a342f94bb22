package io.github.drompincen.webdeck.tools;

import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import io.github.drompincen.webdeck.runtime.exec.ExecutionContext;
import io.github.drompincen.webdeck.runtime.exec.ExecutionFailureException;
import io.github.drompincen.webdeck.runtime.exec.FailureKind;
import io.github.drompincen.webdeck.runtime.exec.StreamingExecutor;
import io.github.drompincen.webdeck.runtime.stream.StreamEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs a terminal command through the requested shell, streaming stdout and stderr
 * chunks as they are produced and finishing with the exit code.
 */
public class ShellCommandExecutor implements StreamingExecutor {

    private static final Logger log = LoggerFactory.getLogger(ShellCommandExecutor.class);

    private WebDeckProperties properties = WebDeckProperties.defaults();
    private WorkingDirectoryResolver directoryResolver;

    @Override public String name() { return "shell"; }

    public void setWebDeckProperties(WebDeckProperties properties) {
        this.properties = properties;
    }

    public void setWorkingDirectoryResolver(WorkingDirectoryResolver directoryResolver) {
        this.directoryResolver = directoryResolver;
    }

    @Override
    public void execute(ExecutionContext ctx, StreamEventSink sink) {
        String command = ctx.text("command");
        if (command == null || command.isBlank()) {
            throw new ExecutionFailureException(FailureKind.LAUNCH, "Command is required");
        }
        ShellKind shell = ShellKind.fromName(ctx.text("shell"), defaultShell());
        Path directory = resolver().resolve(ctx.text("workingDirectory"));

        ProcessBuilder builder = new ProcessBuilder(shell.commandLine(command))
                .directory(directory.toFile())
                .redirectErrorStream(false);
        log.debug("Request {}: {} in {}", ctx.requestId(), builder.command(), directory);

        ProcessSupervisor process;
        try {
            process = ProcessSupervisor.start(builder, ctx, properties.shell().killGrace());
        } catch (IOException e) {
            throw new ExecutionFailureException(FailureKind.LAUNCH,
                    "Failed to start " + shell.executable() + ": " + e.getMessage(), e);
        }
        sink.accept(StreamEvent.start());
        process.pumpChunks(process.stdout(), "stdout", text -> sink.accept(StreamEvent.stdout(text)));
        process.pumpChunks(process.stderr(), "stderr", text -> sink.accept(StreamEvent.stderr(text)));

        int exitCode = process.waitForExit();
        log.debug("Request {}: {} exited with {}", ctx.requestId(), shell.executable(), exitCode);
        sink.accept(StreamEvent.exit(exitCode));
    }

    ShellKind defaultShell() {
        return ShellKind.fromName(properties.shell().defaultShell(), ShellKind.BASH);
    }

    private WorkingDirectoryResolver resolver() {
        if (directoryResolver == null) {
            directoryResolver = WorkingDirectoryResolver.system();
        }
        return directoryResolver;
    }
}
