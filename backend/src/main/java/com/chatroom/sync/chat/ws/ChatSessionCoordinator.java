package com.chatroom.sync.chat.ws;

import com.chatroom.sync.chat.api.MessageItem;
import com.chatroom.sync.chat.service.MessageStore;
import com.chatroom.sync.chat.service.MutationResult;
import com.chatroom.sync.chat.service.MutationStatus;
import com.chatroom.sync.common.config.ChatRoomProperties;
import com.chatroom.sync.common.text.TextSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Turns connection lifecycle and inbound room events into registry/store mutations and the
 * resulting broadcasts. Transport agnostic: connections are addressed by id only.
 *
 * <p>Calls for one connection arrive in transport order; calls for different connections may
 * run concurrently.
 */
@Service
public class ChatSessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionCoordinator.class);

    private final ConnectionRegistry registry;
    private final MessageStore messageStore;
    private final BroadcastDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final int historyLimit;

    public ChatSessionCoordinator(
            ConnectionRegistry registry,
            MessageStore messageStore,
            BroadcastDispatcher dispatcher,
            ObjectMapper objectMapper,
            ChatRoomProperties props
    ) {
        this.registry = registry;
        this.messageStore = messageStore;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.historyLimit = props.historyLimit();
    }

    public void onConnect(String connId) {
        var roster = registry.onConnect(connId);
        dispatcher.toOne(connId, ChatEvents.ROOM_USERS, rosterPayload(roster));

        try {
            var history = messageStore.listActive(historyLimit);
            ObjectNode payload = objectMapper.createObjectNode();
            ArrayNode arr = payload.putArray("messages");
            for (var item : history) {
                arr.add(toJson(item));
            }
            dispatcher.toOne(connId, ChatEvents.MESSAGE_HISTORY, payload);
        } catch (DataAccessException ex) {
            log.warn("history_snapshot_failed connId={}", connId, ex);
            sendError(connId, "store_unavailable", ChatEvents.MESSAGE_HISTORY, null);
        }

        broadcastRoster();
    }

    public void onDisconnect(String connId) {
        registry.onDisconnect(connId);
        broadcastRoster();
    }

    public void setUsername(String connId, String rawName) {
        registry.setName(connId, rawName);
        broadcastRoster();
    }

    public void sendMessage(String connId, String user, String text, JsonNode time) {
        if (text == null || text.isBlank()) {
            sendError(connId, "missing_text", ChatEvents.SEND_MESSAGE, null);
            return;
        }
        var author = registry.setName(connId, user).name();
        var result = messageStore.append(author, text, parseClientTime(time));
        if (!result.applied()) {
            sendError(connId, reasonFor(result.status()), ChatEvents.SEND_MESSAGE, null);
            return;
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("message", toJson(result.message()));
        dispatcher.toAll(ChatEvents.MESSAGE, payload);
        broadcastRoster();
    }

    public void deleteMessage(String connId, String messageId) {
        if (messageId == null || messageId.isBlank()) {
            sendError(connId, "missing_id", ChatEvents.DELETE_MESSAGE, null);
            return;
        }
        var requester = registry.nameOf(connId).orElse(null);
        var result = messageStore.softDelete(messageId, requester);
        if (!result.applied()) {
            rejected(connId, ChatEvents.DELETE_MESSAGE, messageId, result);
            return;
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("id", messageId);
        dispatcher.toAll(ChatEvents.DELETE_MESSAGE, payload);
    }

    public void editMessage(String connId, String messageId, String newText) {
        if (messageId == null || messageId.isBlank()) {
            sendError(connId, "missing_id", ChatEvents.EDIT_MESSAGE, null);
            return;
        }
        if (newText == null || newText.isBlank()) {
            sendError(connId, "missing_text", ChatEvents.EDIT_MESSAGE, messageId);
            return;
        }
        var requester = registry.nameOf(connId).orElse(null);
        var result = messageStore.edit(messageId, requester, newText, Instant.now());
        if (!result.applied()) {
            rejected(connId, ChatEvents.EDIT_MESSAGE, messageId, result);
            return;
        }

        var item = result.message();
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("id", messageId);
        payload.put("new_text", item.body());
        payload.put("edit_time", item.last_edit_at());
        dispatcher.toAll(ChatEvents.EDIT_MESSAGE, payload);
    }

    public void markRead(String connId, String messageId) {
        if (messageId == null || messageId.isBlank()) {
            sendError(connId, "missing_id", ChatEvents.MESSAGE_READ, null);
            return;
        }
        var reader = registry.nameOf(connId).orElse(TextSanitizer.DEFAULT_NAME);
        var result = messageStore.markRead(messageId, reader);
        if (result.status() == MutationStatus.ALREADY) {
            return;
        }
        if (!result.applied()) {
            rejected(connId, ChatEvents.MESSAGE_READ, messageId, result);
            return;
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("id", messageId);
        payload.put("reader_name", reader);
        dispatcher.toAll(ChatEvents.MESSAGE_READ, payload);
    }

    /**
     * Relays a typing fact to everyone but its sender. Holds no timers; expiry is up to the
     * receiving clients.
     */
    public void typing(String connId, String user) {
        var change = registry.setName(connId, user);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("user", change.name());
        payload.put("at", Instant.now().toEpochMilli());
        dispatcher.toAllExcept(connId, ChatEvents.TYPING, payload);

        if (change.changed()) {
            broadcastRoster();
        }
    }

    public void ping(String connId) {
        dispatcher.toOne(connId, ChatEvents.PONG, objectMapper.createObjectNode());
    }

    public void sendError(String connId, String reason, String op, String messageId) {
        ObjectNode err = objectMapper.createObjectNode();
        err.put("reason", reason);
        err.put("message", errorMessageForReason(reason));
        if (op != null) {
            err.put("op", op);
        }
        if (messageId != null && !messageId.isBlank()) {
            err.put("id", messageId);
        }
        dispatcher.toOne(connId, ChatEvents.MESSAGE_ERROR, err);
    }

    private void rejected(String connId, String op, String messageId, MutationResult result) {
        log.debug("mutation_rejected connId={} op={} id={} status={}", connId, op, messageId, result.status());
        sendError(connId, reasonFor(result.status()), op, messageId);
    }

    private void broadcastRoster() {
        dispatcher.toAll(ChatEvents.ROOM_USERS, rosterPayload(registry.snapshotNames()));
    }

    private ObjectNode rosterPayload(List<String> names) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode users = payload.putArray("users");
        names.forEach(users::add);
        return payload;
    }

    private ObjectNode toJson(MessageItem item) {
        return objectMapper.valueToTree(item);
    }

    /**
     * Accepts epoch millis or an ISO-8601 instant/offset date-time; anything else means "now".
     */
    static Instant parseClientTime(JsonNode time) {
        if (time == null || time.isNull() || time.isMissingNode()) return null;
        if (time.isNumber()) {
            return Instant.ofEpochMilli(time.asLong());
        }
        var text = time.asText("").trim();
        if (text.isEmpty()) return null;
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // fall through to offset form
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static String reasonFor(MutationStatus status) {
        return switch (status) {
            case DENIED -> "forbidden";
            case NOT_FOUND -> "message_not_found";
            case RATE_LIMITED -> "edit_rate_limited";
            case UNAVAILABLE -> "store_unavailable";
            case APPLIED, ALREADY -> "ok";
        };
    }

    private static String errorMessageForReason(String reason) {
        return switch (reason) {
            case "missing_text" -> "missing field: text";
            case "missing_id" -> "missing field: id";
            case "forbidden" -> "only the author may change this message";
            case "message_not_found" -> "message not found";
            case "edit_rate_limited" -> "message was edited too recently";
            case "store_unavailable" -> "message store unavailable, try again";
            case "invalid_payload" -> "frame is not a JSON object";
            case "missing_type" -> "missing field: type";
            case "unsupported_type" -> "unsupported message type";
            case "ws_internal_error" -> "internal websocket error";
            default -> reason;
        };
    }
}
