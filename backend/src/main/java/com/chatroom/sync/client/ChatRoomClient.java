package com.chatroom.sync.client;

import com.chatroom.sync.common.config.ChatRoomProperties;
import com.chatroom.sync.common.text.TextSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One owned live session to the room plus the client-side state built from it.
 *
 * <p>Create it when the view mounts and {@link #close()} it when the view goes away; closing
 * drops the transport session, cancels typing timers and stops all listener callbacks.
 * {@link #connect()} may be called again after a disconnect; the server then sends a fresh
 * history and roster.
 */
public class ChatRoomClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChatRoomClient.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final ChatClientSettings settings;
    private final ObjectMapper objectMapper;
    private final WebSocketClient webSocketClient;
    private final ChatViewListener listener;

    private final ClientReconciler reconciler;
    private final TypingAggregator typing;
    private final TypingEmitter typingEmitter;
    private final TextSanitizer nameSanitizer = new TextSanitizer(ChatRoomProperties.defaults());

    private volatile WebSocketSession session;
    private volatile boolean closed;
    private volatile String displayName = "";
    private volatile List<String> roster = List.of();
    private volatile String lastError;

    public ChatRoomClient(
            ChatClientSettings settings,
            ObjectMapper objectMapper,
            WebSocketClient webSocketClient,
            TaskScheduler scheduler,
            ChatViewListener listener
    ) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.webSocketClient = webSocketClient;
        this.listener = listener == null ? new ChatViewListener() { } : listener;
        this.reconciler = new ClientReconciler(settings.scrollTolerancePx());
        this.typing = new TypingAggregator(scheduler, settings.typingWindow(), this::registeredName, this::fireTypingChanged);
        this.typingEmitter = new TypingEmitter(settings.typingMinInterval(), Clock.systemUTC());
    }

    public void connect() throws IOException {
        if (closed) {
            throw new IllegalStateException("client_closed");
        }
        if (isConnected()) return;
        reconciler.awaitHistory();
        try {
            var raw = webSocketClient.execute(new InboundHandler(), settings.serverUri().toString())
                    .get(settings.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
            session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException("connect_interrupted", ex);
        } catch (ExecutionException | TimeoutException ex) {
            throw new IOException("connect_failed " + settings.serverUri(), ex);
        }
        // Name chosen while offline should reach the roster right away.
        if (!displayName.isBlank()) {
            sendFrame("set-username", obj("name", effectiveName()));
        }
    }

    public boolean isConnected() {
        var s = session;
        return s != null && s.isOpen();
    }

    public void setDisplayName(String name) {
        this.displayName = name == null ? "" : name;
        if (isConnected()) {
            sendFrame("set-username", obj("name", effectiveName()));
        }
    }

    public String effectiveName() {
        var trimmed = displayName.trim();
        return trimmed.isEmpty() ? "Anonymous" : trimmed;
    }

    /**
     * This client's name in the form the server stores and relays it, e.g. {@code Tom &amp; Jerry}.
     */
    public String registeredName() {
        return nameSanitizer.cleanName(effectiveName());
    }

    /**
     * Sends a message, or shows it as a local-only echo when the channel is down.
     *
     * @return false if the text was blank and nothing happened
     */
    public boolean send(String text) {
        if (text == null || text.trim().isEmpty()) return false;
        var body = text.trim();
        var now = Instant.now();

        ObjectNode payload = obj("user", effectiveName());
        payload.put("text", body);
        payload.put("time", now.toString());

        if (!isConnected() || !sendFrame("send-message", payload)) {
            log.warn("chat_client_offline_echo author={}", effectiveName());
            reconciler.appendLocalEcho(effectiveName(), body, now.toEpochMilli());
            fireMessagesChanged();
        }
        reconciler.jumpToNewest();
        return true;
    }

    public void editMessage(String messageId, String newText) {
        ObjectNode payload = obj("id", messageId);
        payload.put("new_text", newText);
        sendFrame("edit-message", payload);
    }

    public void deleteMessage(String messageId) {
        sendFrame("delete-message", obj("id", messageId));
    }

    public void markRead(String messageId) {
        sendFrame("message-read", obj("id", messageId));
    }

    /**
     * Feed every change of the composed-but-unsent text here.
     */
    public void onComposeTextChanged(String text) {
        if (!isConnected()) return;
        if (typingEmitter.shouldEmit(text)) {
            sendFrame("typing", obj("user", effectiveName()));
        }
    }

    public void onScroll(int scrollHeight, int scrollTop, int clientHeight) {
        reconciler.onScroll(scrollHeight, scrollTop, clientHeight);
    }

    public void jumpToNewest() {
        reconciler.jumpToNewest();
    }

    public ClientReconciler reconciler() {
        return reconciler;
    }

    public TypingAggregator typing() {
        return typing;
    }

    public List<String> roster() {
        return roster;
    }

    public String lastError() {
        return lastError;
    }

    /**
     * Drops the transport session but keeps local state, so {@link #connect()} can resume.
     */
    public void disconnect() {
        var s = session;
        session = null;
        if (s == null) return;
        try {
            s.close(CloseStatus.NORMAL);
        } catch (IOException ex) {
            log.debug("chat_client_close_failed error={}", ex.toString());
        }
    }

    @Override
    public void close() {
        closed = true;
        disconnect();
        typing.clear();
    }

    private boolean sendFrame(String type, ObjectNode payload) {
        var s = session;
        if (s == null || !s.isOpen()) return false;
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", type);
        frame.setAll(payload);
        try {
            s.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("chat_client_send_failed type={} error={}", type, ex.toString());
            return false;
        }
    }

    private ObjectNode obj(String k, String v) {
        ObjectNode n = objectMapper.createObjectNode();
        n.put(k, v);
        return n;
    }

    private void onFrame(JsonNode root) {
        var type = root.path("type").asText("");
        switch (type) {
            case "message-history" -> {
                List<ClientMessage> history = new ArrayList<>();
                root.path("messages").forEach(n -> history.add(ClientMessage.fromJson(n)));
                reconciler.applyHistory(history);
                fireMessagesChanged();
            }
            case "message" -> {
                if (reconciler.applyMessage(ClientMessage.fromJson(root.path("message")))) fireMessagesChanged();
            }
            case "delete-message" -> {
                if (reconciler.applyDelete(root.path("id").asText())) fireMessagesChanged();
            }
            case "edit-message" -> {
                if (reconciler.applyEdit(root.path("id").asText(), root.path("new_text").asText(""),
                        root.path("edit_time").asLong())) {
                    fireMessagesChanged();
                }
            }
            case "message-read" -> {
                if (reconciler.applyRead(root.path("id").asText(), root.path("reader_name").asText())) {
                    fireMessagesChanged();
                }
            }
            case "typing" -> typing.onTyping(root.path("user").asText(null));
            case "room-users" -> {
                List<String> users = new ArrayList<>();
                root.path("users").forEach(n -> users.add(n.asText()));
                roster = List.copyOf(users);
                if (!closed) listener.onRosterChanged(roster);
            }
            case "message-error" -> {
                var reason = root.path("reason").asText("error");
                lastError = reason;
                log.warn("chat_client_server_error reason={} op={}", reason, root.path("op").asText(""));
                if (!closed) listener.onError(reason, root.path("op").asText(null), root.path("id").asText(null));
            }
            case "pong" -> {
                // keepalive
            }
            default -> log.debug("chat_client_unknown_frame type={}", type);
        }
    }

    private void fireMessagesChanged() {
        if (!closed) listener.onMessagesChanged();
    }

    private void fireTypingChanged() {
        if (!closed) listener.onTypingChanged();
    }

    private class InboundHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession s) {
            log.info("chat_client_connected sessionId={}", s.getId());
            if (!closed) listener.onConnectionChanged(true);
        }

        @Override
        protected void handleTextMessage(WebSocketSession s, TextMessage message) {
            if (closed) return;
            try {
                onFrame(objectMapper.readTree(message.getPayload()));
            } catch (IOException ex) {
                log.warn("chat_client_bad_frame sessionId={} error={}", s.getId(), ex.toString());
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
            log.info("chat_client_disconnected sessionId={} code={}", s.getId(), status.getCode());
            var current = session;
            if (current != null && current.getId().equals(s.getId())) {
                session = null;
            }
            if (!closed) listener.onConnectionChanged(false);
        }
    }
}
