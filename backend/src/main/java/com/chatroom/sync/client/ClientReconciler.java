package com.chatroom.sync.client;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client-side view of the room log: merges the history snapshot with live events and keeps
 * the auto-scroll / unseen-count state.
 *
 * <p>The visible sequence is ordered by {@code createdAt}; a live message with an older
 * timestamp is inserted at its position, equal timestamps keep arrival order. Deleted
 * messages never enter the sequence and an id appears at most once.
 *
 * <p>Between {@link #awaitHistory()} and the next {@link #applyHistory(List)}, live events are
 * held back and replayed on top of the snapshot, since they may or may not be reflected in it.
 * Replaying is harmless: every live event is idempotent against a state that already has it.
 */
public class ClientReconciler {

    private final int scrollTolerancePx;
    private final AtomicLong localSeq = new AtomicLong();

    private final List<ClientMessage> messages = new ArrayList<>();
    private boolean atBottom = true;
    private int unseenCount;

    private boolean awaitingHistory;
    private final List<Runnable> heldBack = new ArrayList<>();

    public ClientReconciler(int scrollTolerancePx) {
        this.scrollTolerancePx = scrollTolerancePx;
    }

    /**
     * Call before (re)connecting: live events are held until the snapshot arrives.
     */
    public synchronized void awaitHistory() {
        awaitingHistory = true;
        heldBack.clear();
    }

    /**
     * Replaces every server-origin message. Local-only echoes stay visible, unreconciled.
     */
    public synchronized void applyHistory(List<ClientMessage> history) {
        var locals = messages.stream().filter(ClientMessage::localOnly).toList();
        messages.clear();
        for (var m : history) {
            if (!m.deleted() && indexOf(m.id()) < 0) insertOrdered(m);
        }
        for (var m : locals) {
            insertOrdered(m);
        }
        atBottom = true;
        unseenCount = 0;

        awaitingHistory = false;
        var pending = List.copyOf(heldBack);
        heldBack.clear();
        pending.forEach(Runnable::run);
    }

    /**
     * @return true if the visible sequence changed
     */
    public synchronized boolean applyMessage(ClientMessage message) {
        if (awaitingHistory) {
            heldBack.add(() -> applyMessage(message));
            return false;
        }
        if (message.deleted() || indexOf(message.id()) >= 0) return false;
        insertOrdered(message);
        if (!atBottom) {
            unseenCount++;
        }
        return true;
    }

    public synchronized boolean applyDelete(String id) {
        if (awaitingHistory) {
            heldBack.add(() -> applyDelete(id));
            return false;
        }
        return messages.removeIf(m -> m.id().equals(id));
    }

    public synchronized boolean applyEdit(String id, String newBody, long editTime) {
        if (awaitingHistory) {
            heldBack.add(() -> applyEdit(id, newBody, editTime));
            return false;
        }
        for (int i = 0; i < messages.size(); i++) {
            var m = messages.get(i);
            if (m.id().equals(id)) {
                messages.set(i, m.withEdit(newBody, editTime));
                return true;
            }
        }
        return false;
    }

    public synchronized boolean applyRead(String id, String reader) {
        if (awaitingHistory) {
            heldBack.add(() -> applyRead(id, reader));
            return false;
        }
        for (int i = 0; i < messages.size(); i++) {
            var m = messages.get(i);
            if (m.id().equals(id)) {
                messages.set(i, m.withReader(reader));
                return true;
            }
        }
        return false;
    }

    /**
     * Scroll observation from the view. Within {@code scrollTolerancePx} of the end counts as
     * at bottom, which also clears the unseen badge.
     */
    public synchronized void onScroll(int scrollHeight, int scrollTop, int clientHeight) {
        atBottom = scrollHeight - scrollTop - clientHeight < scrollTolerancePx;
        if (atBottom) {
            unseenCount = 0;
        }
    }

    public synchronized void jumpToNewest() {
        atBottom = true;
        unseenCount = 0;
    }

    /**
     * Appends a message that exists only in this client's view. It is never sent later.
     */
    public synchronized ClientMessage appendLocalEcho(String author, String body, long now) {
        var echo = ClientMessage.localEcho("local-" + now + "-" + localSeq.incrementAndGet(), author, body, now);
        insertOrdered(echo);
        return echo;
    }

    public synchronized List<ClientMessage> messages() {
        return List.copyOf(messages);
    }

    public synchronized boolean isAtBottom() {
        return atBottom;
    }

    public synchronized int unseenCount() {
        return unseenCount;
    }

    private int indexOf(String id) {
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).id().equals(id)) return i;
        }
        return -1;
    }

    private void insertOrdered(ClientMessage m) {
        int i = messages.size();
        while (i > 0 && messages.get(i - 1).createdAt() > m.createdAt()) {
            i--;
        }
        messages.add(i, m);
    }
}
