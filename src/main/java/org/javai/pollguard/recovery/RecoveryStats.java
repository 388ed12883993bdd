package org.javai.pollguard.recovery;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a {@link ResilientStream}'s recovery bookkeeping.
 *
 * @param streamId The stream
 * @param configuredStrategy The strategy the stream was created with
 * @param activeStrategy The strategy in force now (differs after escalation)
 * @param reestablishments Re-opens performed since creation or the last reset
 * @param lastReestablishAt When the source was last re-opened
 * @param recovering Whether the stream is waiting to re-open or has re-opened without a success yet
 * @param bufferedCount Values waiting for replay
 * @param droppedCount Values dropped because the buffer was full
 * @param breakerOpenUntil End of the current cool-down window, if any
 * @param health Current health
 */
public record RecoveryStats(
        String streamId,
        RecoveryStrategy configuredStrategy,
        RecoveryStrategy activeStrategy,
        int reestablishments,
        Optional<Instant> lastReestablishAt,
        boolean recovering,
        int bufferedCount,
        long droppedCount,
        Optional<Instant> breakerOpenUntil,
        Health health
) {

    public RecoveryStats {
        Objects.requireNonNull(streamId, "streamId must not be null");
        Objects.requireNonNull(configuredStrategy, "configuredStrategy must not be null");
        Objects.requireNonNull(activeStrategy, "activeStrategy must not be null");
        Objects.requireNonNull(lastReestablishAt, "lastReestablishAt must not be null");
        Objects.requireNonNull(breakerOpenUntil, "breakerOpenUntil must not be null");
        Objects.requireNonNull(health, "health must not be null");
    }
}
