package io.cronqueue4j.core;

import java.time.Instant;

/**
 * Immutable job definition produced by JobBuilder.build().
 * This is a pure data object with no persistence logic.
 */
public record JobSpec(

        // scheduling
        Instant dueAt,
        String interval,
        Instant repeatUntil,

        // expiry
        boolean autoRemove
) {
}
