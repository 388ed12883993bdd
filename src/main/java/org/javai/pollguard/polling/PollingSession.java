package org.javai.pollguard.polling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One job being polled. Created by {@link PollingScheduler#startPolling}; closing it stops polling.
 *
 * <p>Ticks, deliveries and cancellation are serialized on the session's own lock, so listener
 * calls never overlap and none happen after {@link #close()} returns.
 *
 * @param <T> The type of value being polled
 */
public final class PollingSession<T> {

    private static final Logger log = LoggerFactory.getLogger(PollingSession.class);

    private final PollingScheduler owner;
    private final PollRegistration<T> registration;
    private final String jobId;
    private final IntervalPolicy policy;
    private final Clock clock;
    private final Instant startedAt;
    private final Instant deadline;
    private final Object lock = new Object();

    // guarded by lock
    private IntervalPolicy.Cadence cadence;
    private T lastObservedValue;
    private boolean observed;
    private boolean closed;
    private ScheduledFuture<?> nextTick;
    private Instant nextTickAt;
    private ScheduledFuture<?> deadlineTimer;
    private CompletableFuture<Outcome<T>> inFlight;
    private long attempts;
    private long successes;
    private long errors;
    private Instant lastActivityAt;
    private ActivityKind lastActivityKind;
    private final Map<ActivityKind, Long> activityCounts = new EnumMap<>(ActivityKind.class);
    private Instant endedAt;

    PollingSession(PollingScheduler owner, PollRegistration<T> registration, IntervalPolicy policy, Clock clock) {
        this.owner = owner;
        this.registration = registration;
        this.jobId = registration.jobId();
        this.policy = policy;
        this.clock = clock;
        this.startedAt = clock.instant();
        Duration sessionTimeout = policy.config().sessionTimeout();
        this.deadline = sessionTimeout == null ? null : startedAt.plus(sessionTimeout);
        this.cadence = policy.initial();
    }

    public String jobId() {
        return jobId;
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Interval that will separate the next tick from the previous one.
     */
    public Duration currentInterval() {
        synchronized (lock) {
            return cadence.interval();
        }
    }

    public PollingMetrics metrics() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    /**
     * Stops this session. Idempotent. An in-flight fetch is cancelled and its result discarded.
     */
    public void close() {
        close(SessionCloseReason.STOPPED);
    }

    void start() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            if (deadline != null) {
                deadlineTimer = owner.schedule(this::expire, Duration.between(clock.instant(), deadline));
            }
            // first tick fires right away
            scheduleTickLocked(Duration.ZERO);
        }
    }

    void close(SessionCloseReason reason) {
        PollingMetrics finalMetrics;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            endedAt = clock.instant();
            cancel(nextTick);
            cancel(deadlineTimer);
            if (inFlight != null) {
                inFlight.cancel(false);
                inFlight = null;
            }
            nextTick = null;
            nextTickAt = null;
            deadlineTimer = null;
            finalMetrics = snapshotLocked();
        }
        owner.sessionClosed(this, reason, finalMetrics);
    }

    /**
     * Applies an external activity hint. Fresh activity pulls a far-off pending tick forward to {@code minInterval}.
     *
     * @return false if the session is already closed
     */
    boolean recordActivity(ActivityKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        synchronized (lock) {
            if (closed) {
                return false;
            }
            Instant now = clock.instant();
            noteActivityLocked(kind, now);
            cadence = policy.next(cadence, kind);
            Duration minInterval = policy.config().minInterval();
            if (kind.isActivity() && nextTick != null && nextTickAt != null
                    && nextTickAt.isAfter(now.plus(minInterval))
                    && nextTick.cancel(false)) {
                log.debug("Activity hint for [{}] pulls next tick forward to {}", jobId, minInterval);
                scheduleTickLocked(minInterval);
            }
            return true;
        }
    }

    private void tick() {
        Duration timeout;
        synchronized (lock) {
            if (closed) {
                return;
            }
            nextTick = null;
            nextTickAt = null;
            timeout = owner.fetchTimeout();
            if (deadline != null) {
                Duration remaining = Duration.between(clock.instant(), deadline);
                if (remaining.isZero() || remaining.isNegative()) {
                    expireLocked();
                    return;
                }
                if (timeout == null || remaining.compareTo(timeout) < 0) {
                    timeout = remaining;
                }
            }
            attempts++;
            owner.attemptStarted();
        }

        CompletableFuture<Outcome<T>> execution = owner.executor().executeWithRetry(jobId, registration.fetch(), timeout);
        synchronized (lock) {
            if (closed) {
                execution.cancel(false);
                return;
            }
            inFlight = execution;
        }
        execution.thenAccept(outcome -> onOutcome(execution, outcome));
    }

    private void onOutcome(CompletableFuture<Outcome<T>> execution, Outcome<T> outcome) {
        synchronized (lock) {
            if (closed || inFlight != execution) {
                return;
            }
            inFlight = null;
            Instant now = clock.instant();
            Duration floor = Duration.ZERO;

            if (outcome instanceof Outcome.Ok<T> ok) {
                handleValueLocked(ok.value(), now);
            } else {
                ClassifiedFailure failure = ((Outcome.Fail<T>) outcome).failure();
                handleFailureLocked(failure, now);
                if (failure.kind() == ErrorKind.CIRCUIT_OPEN) {
                    floor = owner.executor().circuitBreaker().timeUntilTrial(jobId);
                }
            }
            if (closed) {
                return;
            }
            if (deadline != null && !now.isBefore(deadline)) {
                expireLocked();
                return;
            }
            Duration delay = cadence.interval();
            scheduleTickLocked(floor.compareTo(delay) > 0 ? floor : delay);
        }
    }

    private void handleValueLocked(T value, Instant now) {
        ActivityKind kind;
        boolean terminal;
        try {
            kind = registration.classifier().classify(observed ? lastObservedValue : null, value);
            Objects.requireNonNull(kind, "ActivityClassifier returned null");
            terminal = registration.terminal().test(value);
        } catch (RuntimeException e) {
            log.error("Activity classification failed for [{}]", jobId, e);
            owner.reportCallbackFailure(jobId, "classify", e);
            close(SessionCloseReason.CALLBACK_FAILED);
            return;
        }

        ActivityKind activity = kind;
        lastObservedValue = value;
        observed = true;
        successes++;
        owner.succeeded();
        noteActivityLocked(activity, now);
        cadence = policy.next(cadence, activity);

        PollingListener<T> listener = registration.listener();
        deliver("onValue", () -> listener.onValue(value, activity));
        if (terminal) {
            deliver("onTerminal", () -> listener.onTerminal(value));
            close(SessionCloseReason.TERMINAL);
        }
    }

    private void handleFailureLocked(ClassifiedFailure failure, Instant now) {
        errors++;
        owner.failed();
        noteActivityLocked(ActivityKind.ERRORED, now);
        cadence = policy.next(cadence, ActivityKind.ERRORED);
        PollingListener<T> listener = registration.listener();
        deliver("onError", () -> listener.onError(failure));
    }

    private void expire() {
        synchronized (lock) {
            if (!closed) {
                expireLocked();
            }
        }
    }

    private void expireLocked() {
        ClassifiedFailure timeout = ClassifiedFailure.builder(ErrorKind.TIMEOUT,
                        "Polling session exceeded its deadline of " + policy.config().sessionTimeout(), jobId)
                .retryable(false)
                .occurredAt(clock.instant())
                .build();
        errors++;
        owner.failed();
        PollingListener<T> listener = registration.listener();
        deliver("onError", () -> listener.onError(timeout));
        close(SessionCloseReason.DEADLINE_EXCEEDED);
    }

    private void scheduleTickLocked(Duration delay) {
        nextTick = owner.schedule(this::tick, delay);
        if (nextTick == null) {
            close(SessionCloseReason.SHUTDOWN);
            return;
        }
        nextTickAt = clock.instant().plus(delay);
    }

    private void noteActivityLocked(ActivityKind kind, Instant now) {
        activityCounts.merge(kind, 1L, Long::sum);
        lastActivityKind = kind;
        if (kind.isActivity()) {
            lastActivityAt = now;
        }
    }

    private void deliver(String callback, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("PollingListener.{} for [{}] threw; polling continues", callback, jobId, e);
            owner.reportCallbackFailure(jobId, callback, e);
        }
    }

    private PollingMetrics snapshotLocked() {
        return new PollingMetrics(jobId, attempts, successes, errors, cadence.interval(), startedAt,
                Optional.ofNullable(endedAt), Optional.ofNullable(lastActivityAt),
                Optional.ofNullable(lastActivityKind), activityCounts);
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
