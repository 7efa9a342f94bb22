package io.github.drompincen.webdeck.gateway.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.webdeck.protocol.stream.StreamEvent;
import io.github.drompincen.webdeck.runtime.cancel.CancellationToken;
import io.github.drompincen.webdeck.runtime.stream.StreamEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes events as newline-delimited JSON, one flushed record per event. The first
 * failed write means the client has gone: later events are dropped and the request's
 * token is cancelled.
 */
public class NdjsonStreamWriter implements StreamEventSink {

    private static final Logger log = LoggerFactory.getLogger(NdjsonStreamWriter.class);
    public static final String CONTENT_TYPE = "application/x-ndjson";

    private final OutputStream out;
    private final ObjectMapper objectMapper;
    private final String requestId;
    private CancellationToken token;
    private boolean clientGone;

    public NdjsonStreamWriter(OutputStream out, ObjectMapper objectMapper, String requestId) {
        this.out = out;
        this.objectMapper = objectMapper;
        this.requestId = requestId;
    }

    @Override
    public synchronized void accept(StreamEvent event) {
        if (clientGone) {
            return;
        }
        byte[] record;
        try {
            record = objectMapper.writeValueAsBytes(toWire(event));
        } catch (JsonProcessingException e) {
            log.error("Request {}: cannot serialize {} event", requestId, event.wireType(), e);
            return;
        }
        try {
            out.write(record);
            out.write('\n');
            out.flush();
            log.debug("Request {} -> {}", requestId, event.wireType());
        } catch (IOException e) {
            clientGone = true;
            log.debug("Request {}: client disconnected: {}", requestId, e.getMessage());
            if (token != null) {
                token.cancel();
            }
        }
    }

    @Override
    public synchronized void attach(CancellationToken token) {
        this.token = token;
        if (clientGone) {
            token.cancel();
        }
    }

    @Override
    public synchronized void close() {
        if (clientGone) {
            return;
        }
        try {
            out.flush();
        } catch (IOException e) {
            clientGone = true;
            log.debug("Request {}: client disconnected before close: {}", requestId, e.getMessage());
        }
    }

    public synchronized boolean isClientGone() {
        return clientGone;
    }

    ObjectNode toWire(StreamEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.wireType());
        switch (event.type()) {
            case DATA:
                node.set("data", event.data());
                break;
            case ERROR:
                node.put("error", event.error());
                break;
            case EXIT:
                node.put("exitCode", event.exitCode());
                break;
            default:
                break;
        }
        return node;
    }
}
