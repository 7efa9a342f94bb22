package io.github.drompincen.webdeck.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.webdeck.protocol.api.ChatRequest;
import io.github.drompincen.webdeck.protocol.stream.StreamChannel;
import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.runtime.cancel.CancellationToken;
import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import io.github.drompincen.webdeck.runtime.exec.ExecutionContext;
import io.github.drompincen.webdeck.runtime.exec.ExecutionFailureException;
import io.github.drompincen.webdeck.runtime.exec.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssistantQueryExecutorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private AssistantQueryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new AssistantQueryExecutor();
        executor.setObjectMapper(mapper);
        executor.setWorkingDirectoryResolver(new WorkingDirectoryResolver(new PathTranslator(false, tempDir), List.of(tempDir)));
        executor.setExecutableLocator(new ExecutableLocator(null, false));
    }

    @Test
    void commandLineCarriesSessionAndTools() {
        ChatRequest request = new ChatRequest("/review src", "sess-1", "r1", List.of("Bash", "Read"), null, null);

        List<String> command = AssistantQueryExecutor.commandLine("/usr/bin/claude", request);

        assertThat(command).containsExactly("/usr/bin/claude", "-p", "review src",
                "--output-format", "stream-json", "--verbose",
                "--resume", "sess-1", "--allowedTools", "Bash,Read");
    }

    @Test
    void newConversationHasNoResumeFlag() {
        List<String> command = AssistantQueryExecutor.commandLine("claude", new ChatRequest("hi", "r1"));

        assertThat(command).doesNotContain("--resume", "--allowedTools");
    }

    @Test
    void onlyLeadingSlashIsStripped() {
        assertThat(AssistantQueryExecutor.stripSlashCommand("/help")).isEqualTo("help");
        assertThat(AssistantQueryExecutor.stripSlashCommand("path /a/b")).isEqualTo("path /a/b");
    }

    @Test
    void missingMessageIsRejected() {
        ObjectNode params = mapper.createObjectNode().put("requestId", "r1");

        assertThatThrownBy(() -> executor.execute(context(params), new CollectingSink()))
                .isInstanceOf(ExecutionFailureException.class)
                .hasMessage("Message is required");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void relaysJsonLinesAndSkipsOthers() throws Exception {
        useScript("echo '{\"type\":\"system\",\"session_id\":\"s-1\"}'\n"
                + "echo 'not json'\n"
                + "echo '{\"type\":\"result\",\"budget\":\"'\"$MAX_THINKING_TOKENS\"'\"}'\n");
        ObjectNode params = mapper.valueToTree(new ChatRequest("hello", null, "r1", null, null,
                new ChatRequest.Thinking("enabled", 2048)));
        CollectingSink sink = new CollectingSink();

        executor.execute(context(params), sink);

        assertThat(sink.wireTypes()).containsExactly("claude_json", "claude_json", "done");
        StreamEvent first = sink.events().get(0);
        assertThat(first.channel()).isEqualTo(StreamChannel.CLAUDE_JSON);
        assertThat(first.data().get("session_id").asText()).isEqualTo("s-1");
        assertThat(sink.events().get(1).data().get("budget").asText()).isEqualTo("2048");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void assistantReadingStdinIsNotBlocked() throws Exception {
        useScript("cat > /dev/null\necho '{\"type\":\"result\"}'\n");
        CollectingSink sink = new CollectingSink();

        CompletableFuture.runAsync(() ->
                executor.execute(context(mapper.valueToTree(new ChatRequest("hello", "r1"))), sink))
                .get(5, TimeUnit.SECONDS);

        assertThat(sink.wireTypes()).containsExactly("claude_json", "done");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void failedRunIsClassified() throws Exception {
        useScript("echo 'Error: ANTHROPIC_API_KEY is not set' 1>&2\nexit 1\n");
        CollectingSink sink = new CollectingSink();

        assertThatThrownBy(() -> executor.execute(context(mapper.valueToTree(new ChatRequest("hello", "r1"))), sink))
                .isInstanceOf(ExecutionFailureException.class)
                .satisfies(e -> {
                    ExecutionFailureException failure = (ExecutionFailureException) e;
                    assertThat(failure.kind()).isEqualTo(FailureKind.CONFIGURATION);
                    assertThat(failure.getMessage())
                            .startsWith("Claude Code API key is not configured.")
                            .contains("Debug info: Error: ANTHROPIC_API_KEY is not set");
                });
        assertThat(sink.wireTypes()).isEmpty();
    }

    @Test
    void unstartableExecutableIsLaunchFailure() {
        executor.setWebDeckProperties(new WebDeckProperties(
                new WebDeckProperties.Assistant(tempDir.resolve("no-such-claude").toString(), null, null),
                null, null, null));

        assertThatThrownBy(() -> executor.execute(context(mapper.valueToTree(new ChatRequest("hello", "r1"))), new CollectingSink()))
                .isInstanceOf(ExecutionFailureException.class)
                .satisfies(e -> assertThat(((ExecutionFailureException) e).kind()).isEqualTo(FailureKind.LAUNCH));
    }

    private void useScript(String body) throws Exception {
        Path script = Files.writeString(tempDir.resolve("fake-claude"), "#!/bin/sh\n" + body);
        script.toFile().setExecutable(true);
        executor.setWebDeckProperties(new WebDeckProperties(
                new WebDeckProperties.Assistant(script.toString(), null, null), null, null, null));
    }

    private static ExecutionContext context(ObjectNode params) {
        return new ExecutionContext("r1", new CancellationToken("r1", Instant.now()), params);
    }
}
