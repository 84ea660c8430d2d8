package com.chatroom.sync.chat.repo;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class MessageReadRepository {

    private final JdbcTemplate jdbcTemplate;

    public MessageReadRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return false when the reader was already recorded for this message
     */
    public boolean insert(String messageId, String readerName, Instant readAt) {
        try {
            jdbcTemplate.update(
                    "insert into chat_message_read(message_id, reader_name, read_at) values (?, ?, ?)",
                    messageId,
                    readerName,
                    Timestamp.from(readAt)
            );
            return true;
        } catch (DuplicateKeyException dup) {
            return false;
        }
    }

    public boolean exists(String messageId, String readerName) {
        Integer count = jdbcTemplate.queryForObject(
                "select count(*) from chat_message_read where message_id = ? and reader_name = ?",
                Integer.class,
                messageId,
                readerName
        );
        return count != null && count > 0;
    }

    public List<String> listReaders(String messageId) {
        var sql = """
                select reader_name
                from chat_message_read
                where message_id = ?
                order by read_at asc, reader_name asc
                """;
        return jdbcTemplate.queryForList(sql, String.class, messageId);
    }

    /**
     * Readers of the given messages, grouped by message id. Ids without readers are absent.
     */
    public Map<String, List<String>> listReadersOf(List<String> messageIds) {
        Map<String, List<String>> out = new HashMap<>();
        if (messageIds == null || messageIds.isEmpty()) return out;
        var placeholders = String.join(",", messageIds.stream().map((x) -> "?").toList());
        var sql = "select message_id, reader_name from chat_message_read where message_id in (" + placeholders + ")"
                + " order by read_at asc, reader_name asc";
        jdbcTemplate.query(sql, (RowCallbackHandler) rs -> {
            out.computeIfAbsent(rs.getString("message_id"), k -> new ArrayList<>())
                    .add(rs.getString("reader_name"));
        }, messageIds.toArray());
        return out;
    }
}
