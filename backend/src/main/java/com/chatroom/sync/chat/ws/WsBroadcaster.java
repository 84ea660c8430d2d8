package com.chatroom.sync.chat.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class WsBroadcaster implements BroadcastDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WsBroadcaster.class);

    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    private final Counter delivered;
    private final Counter failed;

    // Each session is wrapped so concurrent senders queue in call order instead of failing.
    private final Map<String, WebSocketSession> liveSessions = new ConcurrentHashMap<>();

    public WsBroadcaster(
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Value("${app.ws.send-time-limit-ms:10000}") int sendTimeLimitMs,
            @Value("${app.ws.send-buffer-size-limit:524288}") int sendBufferSizeLimit
    ) {
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
        this.delivered = Counter.builder("chatroom.dispatch.delivered")
                .description("Frames written to a live connection")
                .register(meterRegistry);
        this.failed = Counter.builder("chatroom.dispatch.failed")
                .description("Frames that could not be written to a live connection")
                .register(meterRegistry);
    }

    public void register(WebSocketSession session) {
        if (session == null) return;
        liveSessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit));
    }

    public void unregister(WebSocketSession session) {
        if (session == null) return;
        liveSessions.remove(session.getId());
    }

    @Override
    public void toAll(String event, ObjectNode payload) {
        var frame = encode(event, payload);
        if (frame == null) return;
        for (var s : liveSessions.values()) {
            deliver(s, event, frame);
        }
    }

    @Override
    public void toAllExcept(String connId, String event, ObjectNode payload) {
        var frame = encode(event, payload);
        if (frame == null) return;
        for (var entry : liveSessions.entrySet()) {
            if (entry.getKey().equals(connId)) continue;
            deliver(entry.getValue(), event, frame);
        }
    }

    @Override
    public void toOne(String connId, String event, ObjectNode payload) {
        if (connId == null) return;
        var s = liveSessions.get(connId);
        if (s == null) return;
        var frame = encode(event, payload);
        if (frame == null) return;
        deliver(s, event, frame);
    }

    private TextMessage encode(String event, ObjectNode payload) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", event);
        if (payload != null) {
            frame.setAll(payload);
        }
        try {
            return new TextMessage(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException ex) {
            log.warn("ws_encode_failed type={}", event, ex);
            return null;
        }
    }

    private void deliver(WebSocketSession session, String event, TextMessage frame) {
        if (!session.isOpen()) return;
        try {
            session.sendMessage(frame);
            delivered.increment();
        } catch (IOException | RuntimeException ex) {
            failed.increment();
            log.debug("ws_delivery_failed sessionId={} type={} error={}", session.getId(), event, ex.toString());
        }
    }
}
