package com.chatroom.sync.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides when the composed-but-unsent text should produce an own typing event. With a zero
 * interval every non-empty change emits; receivers handle expiry.
 */
public class TypingEmitter {

    private final Duration minInterval;
    private final Clock clock;
    private Instant lastEmit;

    public TypingEmitter(Duration minInterval, Clock clock) {
        this.minInterval = minInterval == null ? Duration.ZERO : minInterval;
        this.clock = clock;
    }

    public synchronized boolean shouldEmit(String composedText) {
        if (composedText == null || composedText.trim().isEmpty()) {
            return false;
        }
        var now = clock.instant();
        if (!minInterval.isZero() && lastEmit != null && Duration.between(lastEmit, now).compareTo(minInterval) < 0) {
            return false;
        }
        lastEmit = now;
        return true;
    }
}
