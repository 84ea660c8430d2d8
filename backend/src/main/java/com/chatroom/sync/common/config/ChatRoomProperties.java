package com.chatroom.sync.common.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Room-wide limits, bound from {@code app.chat.*}.
 *
 * @param historyLimit   cap on the snapshot sent to a newly connected client and on the one-shot query
 * @param editCooldown   minimum distance between two accepted edits of the same message
 * @param lockStripes    number of stripes used to serialize mutations per message id
 * @param maxTextLength  message bodies are truncated to this many characters before sanitizing
 * @param maxNameLength  display names are truncated to this many characters before sanitizing
 */
@Validated
@ConfigurationProperties(prefix = "app.chat")
public record ChatRoomProperties(
        @DefaultValue("500") @Min(1) @Max(500) int historyLimit,
        @DefaultValue("5m") @NotNull Duration editCooldown,
        @DefaultValue("64") @Min(1) int lockStripes,
        @DefaultValue("4000") @Min(1) int maxTextLength,
        @DefaultValue("100") @Min(1) int maxNameLength
) {

    public static ChatRoomProperties defaults() {
        return new ChatRoomProperties(500, Duration.ofMinutes(5), 64, 4000, 100);
    }
}
