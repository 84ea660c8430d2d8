package com.chatroom.sync.chat.service;

import com.chatroom.sync.common.config.ChatRoomProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of locks keyed by message id hash. Two ids may share a stripe; one id always maps
 * to the same stripe.
 */
@Component
public class MessageLockStripes {

    private final ReentrantLock[] stripes;

    public MessageLockStripes(ChatRoomProperties props) {
        this.stripes = new ReentrantLock[Math.max(1, props.lockStripes())];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String messageId, Supplier<T> action) {
        var lock = stripes[Math.floorMod(messageId.hashCode(), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
