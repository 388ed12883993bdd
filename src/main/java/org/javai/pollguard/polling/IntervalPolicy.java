package org.javai.pollguard.polling;

import java.time.Duration;
import java.util.Objects;

import org.javai.pollguard.config.PollingConfig;

/**
 * Adaptive cadence: fresh activity snaps the interval back to {@code minInterval}; a run of
 * unchanged polls longer than {@code inactivityThreshold} grows it by {@code growthFactor}
 * per poll, up to {@code maxInterval}. Each permanent failure grows it as well.
 */
public final class IntervalPolicy {

    /**
     * Cadence state of one session.
     *
     * @param interval Delay before the next tick
     * @param consecutiveNoChange Unchanged polls since the last activity
     */
    public record Cadence(Duration interval, int consecutiveNoChange) {
        public Cadence {
            Objects.requireNonNull(interval, "interval must not be null");
        }
    }

    private final PollingConfig config;

    public IntervalPolicy(PollingConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public Cadence initial() {
        return new Cadence(config.minInterval(), 0);
    }

    public Cadence next(Cadence current, ActivityKind kind) {
        return switch (kind) {
            case STATUS_CHANGED, DATA_UPDATED, WAIT_TRIGGERED -> new Cadence(config.minInterval(), 0);
            case NO_CHANGE -> {
                int unchanged = current.consecutiveNoChange() + 1;
                Duration interval = unchanged > config.inactivityThreshold()
                        ? grow(current.interval())
                        : current.interval();
                yield new Cadence(interval, unchanged);
            }
            case ERRORED -> new Cadence(grow(current.interval()), current.consecutiveNoChange());
        };
    }

    Duration grow(Duration interval) {
        double grown = interval.toMillis() * config.growthFactor();
        if (grown >= config.maxInterval().toMillis()) {
            return config.maxInterval();
        }
        return Duration.ofMillis(Math.round(grown));
    }

    public PollingConfig config() {
        return config;
    }
}
