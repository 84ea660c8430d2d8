package com.chatroom.sync.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatRoomClientTest {

    private ChatRoomClient newClient() {
        return new ChatRoomClient(ChatClientSettings.defaults(URI.create("ws://localhost:1/ws/chat")),
                new ObjectMapper(), new StandardWebSocketClient(), new ManualTaskScheduler(), null);
    }

    @Test
    void own_escaped_name_is_not_shown_as_typing() {
        try (var client = newClient()) {
            client.setDisplayName(" Tom & Jerry ");

            assertEquals("Tom & Jerry", client.effectiveName());
            assertEquals("Tom &amp; Jerry", client.registeredName());
            assertFalse(client.typing().onTyping("Tom &amp; Jerry"));
            assertTrue(client.typing().onTyping("Bob"));
            assertEquals(Set.of("Bob"), client.typing().activeSubjects());
        }
    }

    @Test
    void offline_send_falls_back_to_local_echo() {
        try (var client = newClient()) {
            assertFalse(client.isConnected());
            assertTrue(client.send("  note  "));
            assertFalse(client.send("   "));

            var view = client.reconciler().messages();
            assertEquals(1, view.size());
            assertEquals("note", view.get(0).body());
            assertTrue(view.get(0).localOnly());
        }
    }
}
