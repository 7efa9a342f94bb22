package io.github.drompincen.webdeck.tools;

import io.github.drompincen.webdeck.protocol.stream.StreamChannel;
import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.protocol.stream.StreamEventType;
import io.github.drompincen.webdeck.runtime.stream.StreamEventSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

class CollectingSink implements StreamEventSink {

    private final List<StreamEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void accept(StreamEvent event) {
        events.add(event);
    }

    List<StreamEvent> events() {
        return events;
    }

    String text(StreamChannel channel) {
        return events.stream()
                .filter(e -> e.type() == StreamEventType.DATA && e.channel() == channel)
                .map(e -> e.data().asText())
                .collect(Collectors.joining());
    }

    List<String> wireTypes() {
        return events.stream().map(StreamEvent::wireType).collect(Collectors.toList());
    }
}
