package com.chatroom.sync.chat.ws;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fan-out of one event to an audience of live connections. Delivery is best-effort per
 * recipient: a failed write to one connection never affects the others.
 */
public interface BroadcastDispatcher {

    void toAll(String event, ObjectNode payload);

    void toAllExcept(String connId, String event, ObjectNode payload);

    void toOne(String connId, String event, ObjectNode payload);
}
