package org.javai.pollguard.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.javai.pollguard.config.RetryConfig;
import org.javai.pollguard.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consecutive-failure circuit breaker, tracked independently per operation key.
 *
 * <p>A key starts CLOSED. After {@code failureThreshold} consecutive failures it opens and
 * rejects attempts until {@code resetTimeout} has elapsed; the next attempt after that is
 * admitted as the single HALF_OPEN trial. A successful trial closes the breaker, a failed
 * one opens it again.
 *
 * <p>Callers follow the usual protocol:
 * <pre>{@code
 * if (breaker.tryAcquire(key)) {
 *     try-the-operation
 *     breaker.recordSuccess(key);   // or recordFailure(key)
 * }
 * }</pre>
 *
 * <p>Each key's state is guarded by its own lock; unrelated keys never contend.
 * Phase changes are reported through {@link OpReporter#reportCircuitTransition}.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final boolean enabled;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final OpReporter reporter;
    private final ConcurrentMap<String, KeyState> states = new ConcurrentHashMap<>();

    public CircuitBreaker(RetryConfig config, Clock clock, OpReporter reporter) {
        this(config.circuitBreakerEnabled(), config.failureThreshold(), config.resetTimeout(), clock, reporter);
    }

    public CircuitBreaker(boolean enabled, int failureThreshold, Duration resetTimeout, Clock clock, OpReporter reporter) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        this.enabled = enabled;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Asks whether an attempt for the key may proceed.
     *
     * @return true if the attempt may run; false if the breaker rejects it
     */
    public boolean tryAcquire(String key) {
        return acquire(key).permitted();
    }

    /**
     * Like {@link #tryAcquire(String)}, but tells the caller whether it was admitted as the half-open trial.
     * A caller holding the trial must eventually record a result or call {@link #abandonTrial(String)}.
     */
    public Admission acquire(String key) {
        if (!enabled) {
            return Admission.ADMITTED;
        }
        KeyState state = states.computeIfAbsent(key, k -> new KeyState());
        Transition transition = null;
        Admission admission;
        synchronized (state) {
            switch (state.phase) {
                case CLOSED -> admission = Admission.ADMITTED;
                case OPEN -> {
                    if (remainingOpenTime(state, clock.instant()).isZero()) {
                        transition = state.moveTo(CircuitPhase.HALF_OPEN);
                        state.trialInFlight = true;
                        admission = Admission.TRIAL;
                    } else {
                        admission = Admission.REJECTED;
                    }
                }
                case HALF_OPEN -> {
                    if (state.trialInFlight) {
                        admission = Admission.REJECTED;
                    } else {
                        state.trialInFlight = true;
                        admission = Admission.TRIAL;
                    }
                }
                default -> throw new IllegalStateException("Unexpected phase: " + state.phase);
            }
        }
        publish(key, transition);
        return admission;
    }

    /**
     * Records a successful attempt: resets the failure counter and closes a half-open breaker.
     */
    public void recordSuccess(String key) {
        if (!enabled) {
            return;
        }
        KeyState state = states.get(key);
        if (state == null) {
            return;
        }
        Transition transition = null;
        synchronized (state) {
            state.consecutiveFailures = 0;
            state.trialInFlight = false;
            if (state.phase != CircuitPhase.CLOSED) {
                transition = state.moveTo(CircuitPhase.CLOSED);
                state.openedAt = null;
            }
        }
        publish(key, transition);
    }

    /**
     * Records a failed attempt, opening the breaker when the threshold is reached or the trial failed.
     */
    public void recordFailure(String key) {
        if (!enabled) {
            return;
        }
        KeyState state = states.computeIfAbsent(key, k -> new KeyState());
        Transition transition = null;
        synchronized (state) {
            state.consecutiveFailures++;
            switch (state.phase) {
                case CLOSED -> {
                    if (state.consecutiveFailures >= failureThreshold) {
                        transition = state.moveTo(CircuitPhase.OPEN);
                        state.openedAt = clock.instant();
                    }
                }
                case HALF_OPEN -> {
                    transition = state.moveTo(CircuitPhase.OPEN);
                    state.openedAt = clock.instant();
                    state.trialInFlight = false;
                }
                case OPEN -> {
                    // a straggler that started before the breaker opened; the open window stands
                }
                default -> throw new IllegalStateException("Unexpected phase: " + state.phase);
            }
        }
        publish(key, transition);
    }

    /**
     * Releases a half-open trial whose attempt was abandoned without a result, so that the
     * next attempt may become the trial instead.
     */
    public void abandonTrial(String key) {
        KeyState state = states.get(key);
        if (state == null) {
            return;
        }
        synchronized (state) {
            if (state.phase == CircuitPhase.HALF_OPEN) {
                state.trialInFlight = false;
            }
        }
    }

    /**
     * Time until an open breaker admits its trial attempt; zero when the key is not open.
     */
    public Duration timeUntilTrial(String key) {
        if (!enabled) {
            return Duration.ZERO;
        }
        KeyState state = states.get(key);
        if (state == null) {
            return Duration.ZERO;
        }
        synchronized (state) {
            if (state.phase != CircuitPhase.OPEN) {
                return Duration.ZERO;
            }
            return remainingOpenTime(state, clock.instant());
        }
    }

    public CircuitBreakerState state(String key) {
        KeyState state = states.get(key);
        if (state == null || !enabled) {
            return CircuitBreakerState.closed();
        }
        synchronized (state) {
            return state.snapshot();
        }
    }

    /**
     * Snapshot of every key the breaker has seen, in no particular order.
     */
    public Map<String, CircuitBreakerState> states() {
        Map<String, CircuitBreakerState> snapshot = new LinkedHashMap<>();
        states.forEach((key, state) -> {
            synchronized (state) {
                snapshot.put(key, state.snapshot());
            }
        });
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Forces the key back to CLOSED with a zero failure count.
     */
    public void reset(String key) {
        KeyState state = states.remove(key);
        if (state == null) {
            return;
        }
        Transition transition = null;
        synchronized (state) {
            if (state.phase != CircuitPhase.CLOSED) {
                transition = new Transition(state.phase, CircuitPhase.CLOSED, 0);
            }
        }
        publish(key, transition);
    }

    public void resetAll() {
        for (String key : states.keySet()) {
            reset(key);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    private Duration remainingOpenTime(KeyState state, Instant now) {
        if (state.openedAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, state.openedAt.plus(resetTimeout));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void publish(String key, Transition transition) {
        if (transition == null) {
            return;
        }
        log.debug("Circuit [{}] {} -> {} after {} consecutive failures",
                key, transition.from(), transition.to(), transition.consecutiveFailures());
        reporter.reportCircuitTransition(key, transition.from(), transition.to(), transition.consecutiveFailures());
    }

    private record Transition(CircuitPhase from, CircuitPhase to, int consecutiveFailures) {
    }

    private static final class KeyState {
        private CircuitPhase phase = CircuitPhase.CLOSED;
        private int consecutiveFailures;
        private Instant openedAt;
        private boolean trialInFlight;

        private Transition moveTo(CircuitPhase next) {
            Transition transition = new Transition(phase, next, consecutiveFailures);
            phase = next;
            return transition;
        }

        private CircuitBreakerState snapshot() {
            Optional<Instant> opened = phase == CircuitPhase.CLOSED ? Optional.empty() : Optional.ofNullable(openedAt);
            return new CircuitBreakerState(phase, consecutiveFailures, opened);
        }
    }
}
