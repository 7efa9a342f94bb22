package io.github.drompincen.webdeck.protocol.stream;

public enum StreamEventType {
    START("start", false),
    DATA("data", false),
    ERROR("error", true),
    ABORTED("aborted", true),
    EXIT("exit", true),
    DONE("done", true);

    private final String wireName;
    private final boolean terminal;

    StreamEventType(String wireName, boolean terminal) {
        this.wireName = wireName;
        this.terminal = terminal;
    }

    public String wireName() { return wireName; }

    public boolean isTerminal() { return terminal; }
}
