package io.github.drompincen.webdeck.runtime.stream;

import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.runtime.cancel.CancellationToken;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingSink implements StreamEventSink {

    private final List<StreamEvent> events = new CopyOnWriteArrayList<>();
    private volatile CancellationToken token;
    private volatile int closeCount;

    @Override
    public void accept(StreamEvent event) {
        events.add(event);
    }

    @Override
    public void attach(CancellationToken token) {
        this.token = token;
    }

    @Override
    public void close() {
        closeCount++;
    }

    public List<StreamEvent> events() { return events; }

    public List<String> wireTypes() {
        return events.stream().map(StreamEvent::wireType).collect(Collectors.toList());
    }

    public long terminalCount() {
        return events.stream().filter(StreamEvent::isTerminal).count();
    }

    public CancellationToken token() { return token; }

    public int closeCount() { return closeCount; }
}
