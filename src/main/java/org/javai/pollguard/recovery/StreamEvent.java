package org.javai.pollguard.recovery;

import java.time.Instant;
import java.util.Objects;

/**
 * What a {@link ResilientStream} delivers on its value channel. Failures never appear here;
 * they surface through {@link Health}.
 *
 * @param <T> The type of value carried
 */
public sealed interface StreamEvent<T> permits StreamEvent.Item, StreamEvent.Heartbeat, StreamEvent.Completed {

    /**
     * Where an item came from.
     */
    enum Origin {
        /** Emitted by the source just now. */
        LIVE,
        /** Substituted for a source error. */
        FALLBACK,
        /** Held back while delivery was impossible and delivered late, in order. */
        REPLAYED
    }

    record Item<T>(T value, Origin origin) implements StreamEvent<T> {
        public Item {
            Objects.requireNonNull(origin, "origin must not be null");
        }
    }

    /**
     * Emitted in place of an error under the degraded strategy: the stream is alive but the value is stale.
     * Carries the coarse health only; the failure itself stays on the health channel.
     */
    record Heartbeat<T>(Instant at, HealthState state, int consecutiveFailures) implements StreamEvent<T> {
        public Heartbeat {
            Objects.requireNonNull(at, "at must not be null");
            Objects.requireNonNull(state, "state must not be null");
        }

        static <T> Heartbeat<T> of(Instant at, Health health) {
            return new Heartbeat<>(at, health.state(), health.consecutiveFailures());
        }
    }

    /**
     * The source completed; nothing follows.
     */
    record Completed<T>() implements StreamEvent<T> {
    }
}
