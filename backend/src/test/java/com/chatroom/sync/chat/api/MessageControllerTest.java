package com.chatroom.sync.chat.api;

import com.chatroom.sync.bootstrap.ChatRoomApplication;
import com.chatroom.sync.chat.service.MessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = ChatRoomApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("dev")
class MessageControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    MessageStore messageStore;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("delete from chat_message_read");
        jdbcTemplate.update("delete from chat_message");
    }

    @Test
    void empty_room_lists_nothing() throws Exception {
        mvc.perform(get("/api/v1/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data").isArray())
                .andExpect(jsonPath("$.data.length()").value(0));
    }

    @Test
    void lists_active_messages_oldest_first() throws Exception {
        var t0 = Instant.parse("2024-03-01T10:00:00Z");
        var second = messageStore.append("Bob", "second", t0.plusSeconds(5)).message();
        var first = messageStore.append("Alice", "first", t0).message();
        var gone = messageStore.append("Alice", "gone", t0.plusSeconds(1)).message();
        messageStore.softDelete(gone.id(), "Alice");
        messageStore.markRead(first.id(), "Bob");

        mvc.perform(get("/api/v1/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].id").value(first.id()))
                .andExpect(jsonPath("$.data[0].created_at").value(t0.toEpochMilli()))
                .andExpect(jsonPath("$.data[0].read_by[0]").value("Bob"))
                .andExpect(jsonPath("$.data[0].deleted").value(false))
                .andExpect(jsonPath("$.data[1].id").value(second.id()))
                .andExpect(jsonPath("$.data[1].author").value("Bob"));
    }

    @Test
    void unknown_path_is_wrapped_as_not_found() throws Exception {
        mvc.perform(get("/api/v1/nothing-here"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.ok").value(false));
    }
}
