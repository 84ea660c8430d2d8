package com.chatroom.sync.client;

import java.net.URI;
import java.time.Duration;

/**
 * @param serverUri            live channel endpoint, e.g. {@code ws://localhost:5000/ws/chat}
 * @param connectTimeout       how long {@link ChatRoomClient#connect()} waits for the handshake
 * @param typingWindow         silence after which a remote typing fact expires
 * @param scrollTolerancePx    distance from the bottom that still counts as "at bottom"
 * @param typingMinInterval    minimum gap between two own typing emissions; zero emits on every change
 */
public record ChatClientSettings(
        URI serverUri,
        Duration connectTimeout,
        Duration typingWindow,
        int scrollTolerancePx,
        Duration typingMinInterval
) {

    public static ChatClientSettings defaults(URI serverUri) {
        return new ChatClientSettings(serverUri, Duration.ofSeconds(10), Duration.ofMillis(2000), 60, Duration.ZERO);
    }
}
