package com.chatroom.sync.chat.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Live channel endpoint. Each text frame is a JSON object whose {@code type} selects the
 * operation; see {@link ChatEvents}.
 */
@Component
public class ChatWsHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWsHandler.class);

    private final ObjectMapper objectMapper;
    private final WsBroadcaster broadcaster;
    private final ChatSessionCoordinator coordinator;

    public ChatWsHandler(ObjectMapper objectMapper, WsBroadcaster broadcaster, ChatSessionCoordinator coordinator) {
        this.objectMapper = objectMapper;
        this.broadcaster = broadcaster;
        this.coordinator = coordinator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("ws_connected sessionId={} remote={}", session.getId(), session.getRemoteAddress());
        broadcaster.register(session);
        coordinator.onConnect(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("ws_disconnected sessionId={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
        broadcaster.unregister(session);
        coordinator.onDisconnect(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error sessionId={} error={}", session.getId(), exception.toString());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        final String connId = session.getId();
        final String rid = "ws_" + connId + "_" + System.nanoTime();
        try {
            JsonNode root = objectMapper.readTree(message.getPayload());
            if (root == null || !root.isObject()) {
                coordinator.sendError(connId, "invalid_payload", null, null);
                return;
            }
            var type = root.path("type").asText(null);
            if (type == null || type.isBlank()) {
                coordinator.sendError(connId, "missing_type", null, null);
                return;
            }

            switch (type) {
                case ChatEvents.SET_USERNAME -> coordinator.setUsername(connId, text(root, "name"));
                case ChatEvents.SEND_MESSAGE -> coordinator.sendMessage(
                        connId, text(root, "user"), text(root, "text"), root.get("time"));
                case ChatEvents.DELETE_MESSAGE -> coordinator.deleteMessage(connId, text(root, "id"));
                case ChatEvents.EDIT_MESSAGE -> coordinator.editMessage(connId, text(root, "id"), text(root, "new_text"));
                case ChatEvents.MESSAGE_READ -> coordinator.markRead(connId, text(root, "id"));
                case ChatEvents.TYPING -> coordinator.typing(connId, text(root, "user"));
                case ChatEvents.PING -> coordinator.ping(connId);
                default -> coordinator.sendError(connId, "unsupported_type", type, null);
            }
        } catch (JsonProcessingException ex) {
            coordinator.sendError(connId, "invalid_payload", null, null);
        } catch (Exception ex) {
            log.warn("ws_internal_error rid={} sessionId={} payload={}", rid, connId, safeOneLine(message.getPayload()), ex);
            coordinator.sendError(connId, "ws_internal_error", null, null);
        }
    }

    private static String text(JsonNode root, String field) {
        var node = root.get(field);
        if (node == null || node.isNull()) return null;
        return node.asText();
    }

    private static String safeOneLine(String s) {
        if (s == null) return "";
        var x = s.replaceAll("[\\r\\n\\t]", " ");
        return x.length() > 500 ? x.substring(0, 500) + "..." : x;
    }
}
