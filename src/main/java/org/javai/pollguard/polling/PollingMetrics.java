package org.javai.pollguard.polling;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of one polling session's counters. Retained after the session ends, with {@link #endedAt()} set.
 *
 * @param jobId The polled job
 * @param attempts Ticks started
 * @param successes Ticks that produced a value
 * @param errors Ticks that produced a failure
 * @param currentInterval Interval before the next tick (the last one used, once ended)
 * @param startedAt When polling started
 * @param endedAt When the session closed
 * @param lastActivityAt When activity was last observed or hinted
 * @param lastActivityKind The most recent activity kind
 * @param activityCounts Observations per activity kind
 */
public record PollingMetrics(
        String jobId,
        long attempts,
        long successes,
        long errors,
        Duration currentInterval,
        Instant startedAt,
        Optional<Instant> endedAt,
        Optional<Instant> lastActivityAt,
        Optional<ActivityKind> lastActivityKind,
        Map<ActivityKind, Long> activityCounts
) {

    public PollingMetrics {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(currentInterval, "currentInterval must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(endedAt, "endedAt must not be null");
        Objects.requireNonNull(lastActivityAt, "lastActivityAt must not be null");
        Objects.requireNonNull(lastActivityKind, "lastActivityKind must not be null");
        activityCounts = activityCounts.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(activityCounts));
    }

    /**
     * Share of completed ticks that produced a value; 0 before any tick completed.
     */
    public double successRate() {
        long completed = successes + errors;
        return completed == 0 ? 0.0 : (double) successes / completed;
    }

    public double errorRate() {
        long completed = successes + errors;
        return completed == 0 ? 0.0 : (double) errors / completed;
    }

    public boolean isActive() {
        return endedAt.isEmpty();
    }

    public long count(ActivityKind kind) {
        return activityCounts.getOrDefault(kind, 0L);
    }

    /**
     * Duration from start to end, or to {@code now} while still active.
     */
    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, endedAt.orElse(now));
    }
}
