package com.chatroom.sync.chat.ws;

/**
 * Frame {@code type} values of the live channel.
 */
public final class ChatEvents {

    // client -> server
    public static final String SET_USERNAME = "set-username";
    public static final String SEND_MESSAGE = "send-message";
    public static final String PING = "ping";

    // both directions
    public static final String DELETE_MESSAGE = "delete-message";
    public static final String EDIT_MESSAGE = "edit-message";
    public static final String MESSAGE_READ = "message-read";
    public static final String TYPING = "typing";

    // server -> client
    public static final String MESSAGE_HISTORY = "message-history";
    public static final String MESSAGE = "message";
    public static final String ROOM_USERS = "room-users";
    public static final String MESSAGE_ERROR = "message-error";
    public static final String PONG = "pong";

    private ChatEvents() {
    }
}
