package com.chatroom.sync.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A message as one client sees it. {@code localOnly} marks an optimistic echo that never
 * reached the server.
 */
public record ClientMessage(
        String id,
        String author,
        String body,
        long createdAt,
        boolean deleted,
        boolean edited,
        Long lastEditAt,
        Set<String> readBy,
        boolean localOnly
) {

    public static ClientMessage fromJson(JsonNode node) {
        Set<String> readers = new LinkedHashSet<>();
        node.path("read_by").forEach(n -> readers.add(n.asText()));
        var lastEdit = node.path("last_edit_at");
        return new ClientMessage(
                node.path("id").asText(),
                node.path("author").asText("Anonymous"),
                node.path("body").asText(""),
                node.path("created_at").asLong(),
                node.path("deleted").asBoolean(false),
                node.path("edited").asBoolean(false),
                lastEdit.isNumber() ? lastEdit.asLong() : null,
                Set.copyOf(readers),
                false
        );
    }

    public static ClientMessage localEcho(String id, String author, String body, long createdAt) {
        return new ClientMessage(id, author, body, createdAt, false, false, null, Set.of(), true);
    }

    public ClientMessage withEdit(String newBody, long editTime) {
        return new ClientMessage(id, author, newBody, createdAt, deleted, true, editTime, readBy, localOnly);
    }

    public ClientMessage withReader(String reader) {
        if (readBy.contains(reader)) return this;
        Set<String> next = new LinkedHashSet<>(readBy);
        next.add(reader);
        return new ClientMessage(id, author, body, createdAt, deleted, edited, lastEditAt, Set.copyOf(next), localOnly);
    }
}
