package io.github.drompincen.webdeck.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.webdeck.protocol.api.ChatRequest;
import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import io.github.drompincen.webdeck.runtime.exec.ExecutionContext;
import io.github.drompincen.webdeck.runtime.exec.ExecutionFailureException;
import io.github.drompincen.webdeck.runtime.exec.FailureClassifier;
import io.github.drompincen.webdeck.runtime.exec.FailureKind;
import io.github.drompincen.webdeck.runtime.exec.StreamingExecutor;
import io.github.drompincen.webdeck.runtime.stream.StreamEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Sends one prompt to the assistant CLI and relays each JSON message it prints.
 */
public class AssistantQueryExecutor implements StreamingExecutor {

    private static final Logger log = LoggerFactory.getLogger(AssistantQueryExecutor.class);
    static final int STDERR_LIMIT = 8192;
    static final String THINKING_ENV = "MAX_THINKING_TOKENS";

    private ObjectMapper objectMapper = new ObjectMapper();
    private WebDeckProperties properties = WebDeckProperties.defaults();
    private WorkingDirectoryResolver directoryResolver;
    private ExecutableLocator executableLocator;

    @Override public String name() { return "assistant"; }

    public void setObjectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void setWebDeckProperties(WebDeckProperties properties) {
        this.properties = properties;
    }

    public void setWorkingDirectoryResolver(WorkingDirectoryResolver directoryResolver) {
        this.directoryResolver = directoryResolver;
    }

    public void setExecutableLocator(ExecutableLocator executableLocator) {
        this.executableLocator = executableLocator;
    }

    @Override
    public void execute(ExecutionContext ctx, StreamEventSink sink) {
        ChatRequest request = parseRequest(ctx);
        String executable = locator().resolve(properties.assistant().executable());
        List<String> command = commandLine(executable, request);

        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(resolver().resolve(request.workingDirectory()).toFile())
                .redirectErrorStream(false);
        if (request.thinking() != null && request.thinking().budgetTokens() > 0) {
            builder.environment().put(THINKING_ENV, String.valueOf(request.thinking().budgetTokens()));
        }
        log.info("Request {}: assistant query, session {}", ctx.requestId(),
                request.sessionId() != null ? request.sessionId() : "new");

        ProcessSupervisor process;
        try {
            process = ProcessSupervisor.start(builder, ctx, properties.assistant().killGrace());
        } catch (IOException e) {
            throw new ExecutionFailureException(FailureKind.LAUNCH,
                    FailureClassifier.describe("Failed to start " + executable + ": " + e.getMessage()), e);
        }

        StringBuilder stderr = new StringBuilder();
        process.pumpLines(process.stdout(), "stdout", line -> forward(ctx, line, sink));
        process.pumpLines(process.stderr(), "stderr", line -> {
            log.debug("Request {}: assistant stderr: {}", ctx.requestId(), line);
            synchronized (stderr) {
                if (stderr.length() < STDERR_LIMIT) {
                    stderr.append(line, 0, Math.min(line.length(), STDERR_LIMIT - stderr.length())).append('\n');
                }
            }
        });

        int exitCode = process.waitForExit();
        if (exitCode != 0) {
            String raw;
            synchronized (stderr) {
                raw = stderr.toString().strip();
            }
            if (raw.isEmpty()) {
                raw = "Claude Code process exited with code " + exitCode;
            }
            throw FailureClassifier.toFailure(raw);
        }
        sink.accept(StreamEvent.done());
    }

    static List<String> commandLine(String executable, ChatRequest request) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-p");
        command.add(stripSlashCommand(request.message()));
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        if (request.sessionId() != null && !request.sessionId().isBlank()) {
            command.add("--resume");
            command.add(request.sessionId());
        }
        if (request.allowedTools() != null && !request.allowedTools().isEmpty()) {
            command.add("--allowedTools");
            command.add(String.join(",", request.allowedTools()));
        }
        return command;
    }

    /** Slash commands arrive as {@code /name args}; the CLI expects them without the slash. */
    static String stripSlashCommand(String message) {
        return message.startsWith("/") ? message.substring(1) : message;
    }

    private void forward(ExecutionContext ctx, String line, StreamEventSink sink) {
        if (line.isBlank()) {
            return;
        }
        try {
            JsonNode message = objectMapper.readTree(line);
            if (message.isObject()) {
                log.trace("Request {}: assistant message {}", ctx.requestId(), line);
                sink.accept(StreamEvent.assistantMessage(message));
            }
        } catch (JsonProcessingException e) {
            log.debug("Request {}: skipping non-JSON assistant output: {}", ctx.requestId(), line);
        }
    }

    private ChatRequest parseRequest(ExecutionContext ctx) {
        ChatRequest request;
        try {
            request = objectMapper.treeToValue(ctx.params(), ChatRequest.class);
        } catch (JsonProcessingException e) {
            throw new ExecutionFailureException(FailureKind.LAUNCH, "Invalid chat request: " + e.getOriginalMessage(), e);
        }
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new ExecutionFailureException(FailureKind.LAUNCH, "Message is required");
        }
        return request;
    }

    private WorkingDirectoryResolver resolver() {
        if (directoryResolver == null) {
            directoryResolver = WorkingDirectoryResolver.system();
        }
        return directoryResolver;
    }

    private ExecutableLocator locator() {
        if (executableLocator == null) {
            executableLocator = ExecutableLocator.system();
        }
        return executableLocator;
    }
}
