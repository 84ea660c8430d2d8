package com.chatroom.sync.client;

import java.util.List;

/**
 * Change notifications for whatever renders the room. Called from transport and scheduler
 * threads.
 */
public interface ChatViewListener {

    default void onConnectionChanged(boolean connected) {
    }

    default void onMessagesChanged() {
    }

    default void onRosterChanged(List<String> users) {
    }

    default void onTypingChanged() {
    }

    default void onError(String reason, String op, String messageId) {
    }
}
