package com.chatroom.sync.chat.service;

import com.chatroom.sync.chat.api.MessageItem;
import com.chatroom.sync.chat.repo.MessageReadRepository;
import com.chatroom.sync.chat.repo.MessageRepository;
import com.chatroom.sync.common.config.ChatRoomProperties;
import com.chatroom.sync.common.text.TextSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Service
public class MessageService implements MessageStore {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final MessageRepository messageRepository;
    private final MessageReadRepository messageReadRepository;
    private final MessageLockStripes locks;
    private final TextSanitizer sanitizer;
    private final Duration editCooldown;
    private final int historyLimit;

    public MessageService(
            MessageRepository messageRepository,
            MessageReadRepository messageReadRepository,
            MessageLockStripes locks,
            TextSanitizer sanitizer,
            ChatRoomProperties props
    ) {
        this.messageRepository = messageRepository;
        this.messageReadRepository = messageReadRepository;
        this.locks = locks;
        this.sanitizer = sanitizer;
        this.editCooldown = props.editCooldown();
        this.historyLimit = props.historyLimit();
    }

    @Override
    public MutationResult append(String author, String body, Instant timestamp) {
        var createdAt = timestamp == null ? Instant.now() : timestamp;
        var cleanAuthor = displayName(author);
        var cleanBody = sanitizer.cleanText(body);
        try {
            var row = messageRepository.insert(cleanAuthor, cleanBody, createdAt);
            return MutationResult.applied(toItem(row, List.of()));
        } catch (DataAccessException ex) {
            log.warn("message_append_failed author={}", cleanAuthor, ex);
            return MutationResult.of(MutationStatus.UNAVAILABLE);
        }
    }

    @Override
    public List<MessageItem> listActive(int limit) {
        var safeLimit = Math.max(1, Math.min(limit, historyLimit));
        var rows = messageRepository.listActive(safeLimit);
        if (rows.isEmpty()) return List.of();
        var readers = messageReadRepository.listReadersOf(rows.stream().map(MessageRepository.MessageRow::id).toList());
        return rows.stream()
                .map(row -> toItem(row, readers.getOrDefault(row.id(), List.of())))
                .toList();
    }

    @Override
    public Optional<MessageItem> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return messageRepository.findById(id)
                .map(row -> toItem(row, messageReadRepository.listReaders(id)));
    }

    @Override
    public MutationResult softDelete(String id, String requestingAuthor) {
        if (id == null || id.isBlank()) return MutationResult.of(MutationStatus.NOT_FOUND);
        return guarded("message_delete_failed", id, () -> locks.withLock(id, () -> {
            var row = messageRepository.findById(id).orElse(null);
            if (row == null || row.deleted()) {
                return MutationResult.of(MutationStatus.NOT_FOUND);
            }
            if (!isAuthor(row, requestingAuthor)) {
                return MutationResult.of(MutationStatus.DENIED);
            }
            messageRepository.markDeleted(id);
            var deleted = new MessageRepository.MessageRow(
                    row.id(), row.author(), row.body(), row.createdAt(), true, row.edited(), row.lastEditAt());
            return MutationResult.applied(toItem(deleted, messageReadRepository.listReaders(id)));
        }));
    }

    @Override
    public MutationResult edit(String id, String requestingAuthor, String newBody, Instant now) {
        if (id == null || id.isBlank()) return MutationResult.of(MutationStatus.NOT_FOUND);
        var editedAt = now == null ? Instant.now() : now;
        var cleanBody = sanitizer.cleanText(newBody);
        return guarded("message_edit_failed", id, () -> locks.withLock(id, () -> {
            var row = messageRepository.findById(id).orElse(null);
            if (row == null || row.deleted()) {
                return MutationResult.of(MutationStatus.NOT_FOUND);
            }
            if (!isAuthor(row, requestingAuthor)) {
                return MutationResult.of(MutationStatus.DENIED);
            }
            // A clock running backwards lands here too, so last_edit_at never decreases.
            if (row.lastEditAt() != null && Duration.between(row.lastEditAt(), editedAt).compareTo(editCooldown) < 0) {
                return MutationResult.of(MutationStatus.RATE_LIMITED);
            }
            messageRepository.updateBody(id, cleanBody, editedAt);
            var edited = new MessageRepository.MessageRow(
                    row.id(), row.author(), cleanBody, row.createdAt(), false, true, editedAt);
            return MutationResult.applied(toItem(edited, messageReadRepository.listReaders(id)));
        }));
    }

    @Override
    public MutationResult markRead(String id, String readerName) {
        if (id == null || id.isBlank()) return MutationResult.of(MutationStatus.NOT_FOUND);
        var reader = displayName(readerName);
        return guarded("message_read_failed", id, () -> locks.withLock(id, () -> {
            var row = messageRepository.findById(id).orElse(null);
            if (row == null || row.deleted()) {
                return MutationResult.of(MutationStatus.NOT_FOUND);
            }
            if (messageReadRepository.exists(id, reader) || !messageReadRepository.insert(id, reader, Instant.now())) {
                return MutationResult.of(MutationStatus.ALREADY);
            }
            return MutationResult.applied(toItem(row, messageReadRepository.listReaders(id)));
        }));
    }

    private MutationResult guarded(String event, String id, Supplier<MutationResult> op) {
        try {
            return op.get();
        } catch (DataAccessException ex) {
            log.warn("{} id={}", event, id, ex);
            return MutationResult.of(MutationStatus.UNAVAILABLE);
        }
    }

    // Names arrive in their registry form; sanitizing again would escape them twice.
    private static String displayName(String name) {
        return name == null || name.isBlank() ? TextSanitizer.DEFAULT_NAME : name;
    }

    private static boolean isAuthor(MessageRepository.MessageRow row, String requestingAuthor) {
        return requestingAuthor != null && requestingAuthor.equals(row.author());
    }

    private static MessageItem toItem(MessageRepository.MessageRow row, List<String> readers) {
        return new MessageItem(
                row.id(),
                row.author(),
                row.body(),
                row.createdAt().toEpochMilli(),
                row.deleted(),
                row.edited(),
                row.lastEditAt() == null ? null : row.lastEditAt().toEpochMilli(),
                List.copyOf(readers)
        );
    }
}
