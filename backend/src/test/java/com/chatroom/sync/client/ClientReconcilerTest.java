package com.chatroom.sync.client;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientReconcilerTest {

    private static ClientMessage msg(String id, long createdAt) {
        return new ClientMessage(id, "Alice", "body " + id, createdAt, false, false, null, Set.of(), false);
    }

    @Test
    void unseen_count_grows_while_scrolled_up_and_resets_on_jump() {
        var r = new ClientReconciler(60);
        r.applyHistory(List.of(msg("m1", 1)));

        r.onScroll(2000, 500, 400);
        assertFalse(r.isAtBottom());

        r.applyMessage(msg("m2", 2));
        r.applyMessage(msg("m3", 3));
        r.applyMessage(msg("m4", 4));
        assertEquals(3, r.unseenCount());

        r.jumpToNewest();
        assertEquals(0, r.unseenCount());
        assertTrue(r.isAtBottom());
        assertEquals(4, r.messages().size());
    }

    @Test
    void at_bottom_follows_without_counting() {
        var r = new ClientReconciler(60);
        r.applyMessage(msg("m1", 1));
        r.applyMessage(msg("m2", 2));
        assertEquals(0, r.unseenCount());
        assertTrue(r.isAtBottom());
    }

    @Test
    void scroll_within_tolerance_counts_as_bottom() {
        var r = new ClientReconciler(60);
        r.onScroll(2000, 500, 400);
        r.applyMessage(msg("m1", 1));
        assertEquals(1, r.unseenCount());

        // 2000 - 1545 - 400 = 55 < 60
        r.onScroll(2000, 1545, 400);
        assertTrue(r.isAtBottom());
        assertEquals(0, r.unseenCount());

        // 2000 - 1540 - 400 = 60, not < 60
        r.onScroll(2000, 1540, 400);
        assertFalse(r.isAtBottom());
    }

    @Test
    void history_replaces_view_and_resets_scroll_state() {
        var r = new ClientReconciler(60);
        r.applyMessage(msg("old", 1));
        r.onScroll(2000, 0, 400);
        r.applyMessage(msg("old2", 2));
        assertEquals(1, r.unseenCount());

        r.applyHistory(List.of(msg("h1", 10), msg("h2", 20)));

        assertEquals(List.of("h1", "h2"), r.messages().stream().map(ClientMessage::id).toList());
        assertTrue(r.isAtBottom());
        assertEquals(0, r.unseenCount());
    }

    @Test
    void history_skips_deleted_entries() {
        var r = new ClientReconciler(60);
        var tomb = new ClientMessage("gone", "Bob", "x", 5, true, false, null, Set.of(), false);
        r.applyHistory(List.of(msg("h1", 1), tomb));
        assertEquals(List.of("h1"), r.messages().stream().map(ClientMessage::id).toList());
    }

    @Test
    void local_echo_survives_a_fresh_history() {
        var r = new ClientReconciler(60);
        var echo = r.appendLocalEcho("Alice", "offline hi", 100);
        assertTrue(echo.id().startsWith("local-"));
        assertTrue(echo.localOnly());

        r.applyHistory(List.of(msg("h1", 50), msg("h2", 150)));

        assertEquals(List.of("h1", echo.id(), "h2"), r.messages().stream().map(ClientMessage::id).toList());
    }

    @Test
    void live_messages_are_kept_in_created_at_order() {
        var r = new ClientReconciler(60);
        r.applyMessage(msg("a", 10));
        r.applyMessage(msg("c", 30));
        r.applyMessage(msg("b", 20));
        r.applyMessage(msg("c2", 30));

        assertEquals(List.of("a", "b", "c", "c2"), r.messages().stream().map(ClientMessage::id).toList());
    }

    @Test
    void delete_edit_and_read_update_the_view() {
        var r = new ClientReconciler(60);
        r.applyHistory(List.of(msg("m1", 1), msg("m2", 2)));

        assertTrue(r.applyEdit("m1", "changed", 99));
        assertTrue(r.applyRead("m1", "Bob"));
        assertTrue(r.applyRead("m1", "Bob"));
        assertTrue(r.applyDelete("m2"));
        assertFalse(r.applyDelete("missing"));

        var only = r.messages();
        assertEquals(1, only.size());
        assertEquals("changed", only.get(0).body());
        assertTrue(only.get(0).edited());
        assertEquals(99L, only.get(0).lastEditAt());
        assertEquals(Set.of("Bob"), only.get(0).readBy());
    }

    @Test
    void live_copy_of_a_snapshot_message_is_not_duplicated() {
        var r = new ClientReconciler(60);
        r.awaitHistory();
        r.applyHistory(List.of(msg("m1", 1)));
        r.onScroll(2000, 0, 400);

        assertFalse(r.applyMessage(msg("m1", 1)));

        assertEquals(List.of("m1"), r.messages().stream().map(ClientMessage::id).toList());
        assertEquals(0, r.unseenCount());
    }

    @Test
    void live_message_arriving_before_the_snapshot_survives_it() {
        var r = new ClientReconciler(60);
        r.awaitHistory();

        assertFalse(r.applyMessage(msg("m2", 2)));
        assertTrue(r.messages().isEmpty());

        r.applyHistory(List.of(msg("m1", 1)));

        assertEquals(List.of("m1", "m2"), r.messages().stream().map(ClientMessage::id).toList());
        assertEquals(0, r.unseenCount());
    }

    @Test
    void held_back_events_replay_on_top_of_the_snapshot() {
        var r = new ClientReconciler(60);
        r.awaitHistory();

        r.applyMessage(msg("m1", 1));
        r.applyEdit("m1", "changed", 50);
        r.applyRead("m1", "Bob");
        r.applyDelete("m2");

        r.applyHistory(List.of(msg("m1", 1), msg("m2", 2)));

        var view = r.messages();
        assertEquals(1, view.size());
        assertEquals("changed", view.get(0).body());
        assertEquals(Set.of("Bob"), view.get(0).readBy());
    }
}
