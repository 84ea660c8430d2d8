package com.chatroom.sync.chat.service;

public enum MutationStatus {
    APPLIED,
    /** markRead only: the reader was already recorded. */
    ALREADY,
    DENIED,
    NOT_FOUND,
    RATE_LIMITED,
    UNAVAILABLE
}
