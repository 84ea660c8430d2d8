package com.chatroom.sync.chat.service;

import com.chatroom.sync.chat.api.MessageItem;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only message log of the room.
 *
 * <p>Mutations never throw for domain or storage failures; they report a {@link MutationStatus}
 * so the caller decides whether anything is broadcast. Mutations targeting the same id are
 * serialized; everything else may run concurrently.
 *
 * <p>Author, requester and reader names are display names as held by {@code ConnectionRegistry},
 * already sanitized, and are stored and compared verbatim. Bodies are raw and sanitized here.
 */
public interface MessageStore {

    /**
     * Persists a new, non-deleted message. A null {@code timestamp} means "now".
     */
    MutationResult append(String author, String body, Instant timestamp);

    /**
     * Up to {@code limit} non-deleted messages, oldest first, ties in insertion order.
     */
    List<MessageItem> listActive(int limit);

    /**
     * Internal lookup that also returns tombstoned messages.
     */
    Optional<MessageItem> findById(String id);

    MutationResult softDelete(String id, String requestingAuthor);

    MutationResult edit(String id, String requestingAuthor, String newBody, Instant now);

    MutationResult markRead(String id, String readerName);
}
