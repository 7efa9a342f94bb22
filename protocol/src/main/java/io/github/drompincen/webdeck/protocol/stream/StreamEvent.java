package io.github.drompincen.webdeck.protocol.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * One record of a request's output stream. Only the fields relevant to {@link #type()}
 * are populated; the rest are null.
 */
public record StreamEvent(
        StreamEventType type,
        StreamChannel channel,
        JsonNode data,
        String error,
        Integer exitCode
) {
    public static StreamEvent start() {
        return new StreamEvent(StreamEventType.START, null, null, null, null);
    }

    public static StreamEvent data(StreamChannel channel, JsonNode data) {
        return new StreamEvent(StreamEventType.DATA, channel, data, null, null);
    }

    public static StreamEvent stdout(String text) {
        return data(StreamChannel.STDOUT, new TextNode(text));
    }

    public static StreamEvent stderr(String text) {
        return data(StreamChannel.STDERR, new TextNode(text));
    }

    public static StreamEvent assistantMessage(JsonNode message) {
        return data(StreamChannel.CLAUDE_JSON, message);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(StreamEventType.ERROR, null, null, message, null);
    }

    public static StreamEvent aborted() {
        return new StreamEvent(StreamEventType.ABORTED, null, null, null, null);
    }

    public static StreamEvent exit(int exitCode) {
        return new StreamEvent(StreamEventType.EXIT, null, null, null, exitCode);
    }

    public static StreamEvent done() {
        return new StreamEvent(StreamEventType.DONE, null, null, null, null);
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }

    /** Value of the {@code type} field on the wire. */
    public String wireType() {
        return type == StreamEventType.DATA ? channel.wireName() : type.wireName();
    }
}
