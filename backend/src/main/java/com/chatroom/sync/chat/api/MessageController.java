package com.chatroom.sync.chat.api;

import com.chatroom.sync.chat.service.MessageStore;
import com.chatroom.sync.common.api.ApiResponse;
import com.chatroom.sync.common.config.ChatRoomProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * One-shot history fetch for clients that do not open the live channel.
 */
@RestController
@RequestMapping("/api/v1")
public class MessageController {

    private final MessageStore messageStore;
    private final int historyLimit;

    public MessageController(MessageStore messageStore, ChatRoomProperties props) {
        this.messageStore = messageStore;
        this.historyLimit = props.historyLimit();
    }

    @GetMapping("/messages")
    public ApiResponse<List<MessageItem>> list() {
        return ApiResponse.ok(messageStore.listActive(historyLimit));
    }
}
