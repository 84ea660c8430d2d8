package com.chatroom.sync.client;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Remote "is typing" facts, one expiry timer per subject. A new fact for a subject cancels
 * its pending timer and starts a fresh window.
 */
public class TypingAggregator {

    private record Expiry(Object token, ScheduledFuture<?> future) {
    }

    private final TaskScheduler scheduler;
    private final Duration window;
    private final Supplier<String> selfName;
    private final Runnable onChange;

    private final Map<String, Expiry> timers = new HashMap<>();
    private final Set<String> active = new LinkedHashSet<>();

    public TypingAggregator(TaskScheduler scheduler, Duration window, Supplier<String> selfName, Runnable onChange) {
        this.scheduler = scheduler;
        this.window = window;
        this.selfName = selfName;
        this.onChange = onChange == null ? () -> { } : onChange;
    }

    /**
     * @return false when the fact was about this client itself and got ignored
     */
    public boolean onTyping(String subject) {
        var who = subject == null || subject.isBlank() ? "Someone" : subject.trim();
        if (who.equals(selfName.get())) {
            return false;
        }

        boolean added;
        synchronized (this) {
            var previous = timers.remove(who);
            if (previous != null) {
                previous.future().cancel(false);
            }
            added = active.add(who);
            var token = new Object();
            var future = scheduler.schedule(() -> expire(who, token), scheduler.getClock().instant().plus(window));
            timers.put(who, new Expiry(token, future));
        }
        if (added) {
            onChange.run();
        }
        return true;
    }

    public synchronized Set<String> activeSubjects() {
        return Set.copyOf(active);
    }

    public synchronized boolean isActive(String subject) {
        return active.contains(subject);
    }

    /**
     * Cancels every pending timer and forgets all subjects.
     */
    public void clear() {
        boolean hadAny;
        synchronized (this) {
            timers.values().forEach(e -> e.future().cancel(false));
            timers.clear();
            hadAny = !active.isEmpty();
            active.clear();
        }
        if (hadAny) {
            onChange.run();
        }
    }

    private void expire(String who, Object token) {
        synchronized (this) {
            var current = timers.get(who);
            // A refresh replaced this timer after it had already started running.
            if (current == null || current.token() != token) {
                return;
            }
            timers.remove(who);
            active.remove(who);
        }
        onChange.run();
    }
}
