package com.chatroom.sync.chat.ws;

import com.chatroom.sync.common.text.TextSanitizer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live connection id to display name. The single source of the online roster.
 *
 * <p>Roster order is connection order. Names are not keys: two connections may share one.
 */
@Component
public class ConnectionRegistry {

    public record NameChange(String name, boolean changed) {
    }

    private final TextSanitizer sanitizer;

    private final Map<String, String> names = new LinkedHashMap<>();

    public ConnectionRegistry(TextSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public synchronized List<String> onConnect(String connId) {
        names.put(connId, TextSanitizer.DEFAULT_NAME);
        return snapshotNames();
    }

    /**
     * Stores the sanitized name for a live connection. For an unknown (already closed)
     * connection the name is still sanitized and returned, but nothing is stored.
     */
    public synchronized NameChange setName(String connId, String rawName) {
        var clean = sanitizer.cleanName(rawName);
        var previous = names.get(connId);
        if (previous == null) {
            return new NameChange(clean, false);
        }
        names.put(connId, clean);
        return new NameChange(clean, !previous.equals(clean));
    }

    /**
     * @return true if an entry was removed; repeated calls are harmless
     */
    public synchronized boolean onDisconnect(String connId) {
        return names.remove(connId) != null;
    }

    public synchronized Optional<String> nameOf(String connId) {
        return Optional.ofNullable(names.get(connId));
    }

    public synchronized List<String> snapshotNames() {
        return List.copyOf(names.values());
    }

    public synchronized int size() {
        return names.size();
    }
}
