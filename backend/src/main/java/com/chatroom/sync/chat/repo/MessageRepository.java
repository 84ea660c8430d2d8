package com.chatroom.sync.chat.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class MessageRepository {

    public record MessageRow(
            String id,
            String author,
            String body,
            Instant createdAt,
            boolean deleted,
            boolean edited,
            Instant lastEditAt
    ) {
    }

    private static final RowMapper<MessageRow> ROW_MAPPER = (rs, rowNum) -> {
        var lastEdit = rs.getTimestamp("last_edit_at");
        return new MessageRow(
                rs.getString("id"),
                rs.getString("author"),
                rs.getString("body"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getBoolean("deleted"),
                rs.getBoolean("edited"),
                lastEdit == null ? null : lastEdit.toInstant()
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public MessageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public MessageRow insert(String author, String body, Instant createdAt) {
        var id = "m_" + UUID.randomUUID();
        var sql = """
                insert into chat_message(id, author, body, created_at, deleted, edited, last_edit_at)
                values (?, ?, ?, ?, false, false, null)
                """;
        jdbcTemplate.update(sql, id, author, body, Timestamp.from(createdAt));
        return new MessageRow(id, author, body, createdAt, false, false, null);
    }

    /**
     * Looks a message up by id, tombstones included.
     */
    public Optional<MessageRow> findById(String id) {
        var sql = """
                select id, author, body, created_at, deleted, edited, last_edit_at
                from chat_message
                where id = ?
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, id).stream().findFirst();
    }

    public List<MessageRow> listActive(int limit) {
        var sql = """
                select id, author, body, created_at, deleted, edited, last_edit_at
                from chat_message
                where deleted = false
                order by created_at asc, seq asc
                limit ?
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, limit);
    }

    public int markDeleted(String id) {
        return jdbcTemplate.update("update chat_message set deleted = true where id = ? and deleted = false", id);
    }

    public int updateBody(String id, String body, Instant editedAt) {
        var sql = """
                update chat_message
                set body = ?, edited = true, last_edit_at = ?
                where id = ? and deleted = false
                """;
        return jdbcTemplate.update(sql, body, Timestamp.from(editedAt), id);
    }
}
