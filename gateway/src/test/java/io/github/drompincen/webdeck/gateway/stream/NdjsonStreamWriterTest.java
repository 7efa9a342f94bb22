package io.github.drompincen.webdeck.gateway.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.runtime.cancel.CancellationToken;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NdjsonStreamWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private List<JsonNode> lines(ByteArrayOutputStream out) throws IOException {
        List<JsonNode> nodes = new ArrayList<>();
        for (String line : out.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isEmpty()) {
                nodes.add(mapper.readTree(line));
            }
        }
        return nodes;
    }

    @Test
    void writesOneJsonRecordPerLine() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        NdjsonStreamWriter writer = new NdjsonStreamWriter(out, mapper, "r1");

        writer.accept(StreamEvent.start());
        writer.accept(StreamEvent.stdout("hello\n"));
        writer.accept(StreamEvent.stderr("oops"));
        writer.accept(StreamEvent.exit(3));
        writer.close();

        assertThat(out.toString(StandardCharsets.UTF_8)).endsWith("\n");
        List<JsonNode> nodes = lines(out);
        assertThat(nodes).hasSize(4);
        assertThat(nodes.get(0).get("type").asText()).isEqualTo("start");
        assertThat(nodes.get(1).get("type").asText()).isEqualTo("stdout");
        assertThat(nodes.get(1).get("data").asText()).isEqualTo("hello\n");
        assertThat(nodes.get(2).get("type").asText()).isEqualTo("stderr");
        assertThat(nodes.get(3).get("type").asText()).isEqualTo("exit");
        assertThat(nodes.get(3).get("exitCode").asInt()).isEqualTo(3);
    }

    @Test
    void assistantMessagesKeepTheirStructure() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        NdjsonStreamWriter writer = new NdjsonStreamWriter(out, mapper, "r1");

        writer.accept(StreamEvent.assistantMessage(mapper.readTree("{\"type\":\"assistant\",\"n\":1}")));
        writer.accept(StreamEvent.error("boom"));
        writer.accept(StreamEvent.done());

        List<JsonNode> nodes = lines(out);
        assertThat(nodes.get(0).get("type").asText()).isEqualTo("claude_json");
        assertThat(nodes.get(0).get("data").get("n").asInt()).isEqualTo(1);
        assertThat(nodes.get(1).get("error").asText()).isEqualTo("boom");
        assertThat(nodes.get(2).get("type").asText()).isEqualTo("done");
        assertThat(nodes.get(2).has("data")).isFalse();
    }

    @Test
    void failedWriteCancelsTokenAndDropsLaterEvents() {
        FailingOutputStream out = new FailingOutputStream();
        NdjsonStreamWriter writer = new NdjsonStreamWriter(out, mapper, "r1");
        CancellationToken token = new CancellationToken("r1", Instant.now());
        writer.attach(token);

        writer.accept(StreamEvent.start());
        writer.accept(StreamEvent.stdout("more"));
        writer.close();

        assertThat(writer.isClientGone()).isTrue();
        assertThat(token.isCancelled()).isTrue();
        assertThat(out.attempts).isEqualTo(1);
    }

    @Test
    void attachAfterDisconnectCancelsImmediately() {
        NdjsonStreamWriter writer = new NdjsonStreamWriter(new FailingOutputStream(), mapper, "r1");
        writer.accept(StreamEvent.start());

        CancellationToken token = new CancellationToken("r1", Instant.now());
        writer.attach(token);

        assertThat(token.isCancelled()).isTrue();
    }

    private static final class FailingOutputStream extends OutputStream {
        int attempts;

        @Override
        public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            attempts++;
            throw new IOException("Broken pipe");
        }
    }
}
