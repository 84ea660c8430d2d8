package com.chatroom.sync.chat.api;

import java.util.List;

/**
 * Wire shape of a chat message. Timestamps are epoch milliseconds.
 */
public record MessageItem(
        String id,
        String author,
        String body,
        long created_at,
        boolean deleted,
        boolean edited,
        Long last_edit_at,
        List<String> read_by
) {
}
