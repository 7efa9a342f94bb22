package io.github.drompincen.webdeck.protocol.stream;

/**
 * Source of a {@link StreamEventType#DATA} event. The wire name doubles as the record's
 * {@code type} field so existing clients can switch on it directly.
 */
public enum StreamChannel {
    STDOUT("stdout"),
    STDERR("stderr"),
    CLAUDE_JSON("claude_json");

    private final String wireName;

    StreamChannel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
