package com.chatroom.sync.chat.service;

import com.chatroom.sync.chat.api.MessageItem;

/**
 * Outcome of a store operation. {@code message} is the state after the mutation and is only
 * set when {@code status} is {@link MutationStatus#APPLIED}.
 */
public record MutationResult(MutationStatus status, MessageItem message) {

    public static MutationResult applied(MessageItem message) {
        return new MutationResult(MutationStatus.APPLIED, message);
    }

    public static MutationResult of(MutationStatus status) {
        return new MutationResult(status, null);
    }

    public boolean applied() {
        return status == MutationStatus.APPLIED;
    }
}
