package org.javai.pollguard.retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.DoubleSupplier;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.Outcome;
import org.javai.pollguard.boundary.Boundary;
import org.javai.pollguard.boundary.DefaultErrorClassifier;
import org.javai.pollguard.breaker.Admission;
import org.javai.pollguard.breaker.CircuitBreaker;
import org.javai.pollguard.breaker.CircuitPhase;
import org.javai.pollguard.config.RetryConfig;
import org.javai.pollguard.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs asynchronous operations with bounded retry, exponential backoff and circuit-breaker gating.
 * Operates entirely over Outcome values: the returned future never completes exceptionally.
 *
 * <p>Backoff waits are scheduled on the shared {@link ScheduledExecutorService}; no thread
 * blocks while an execution waits for its next attempt.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryExecutor executor = RetryExecutor.builder()
 *     .config(RetryConfig.builder().maxRetries(3).build())
 *     .scheduler(scheduler)
 *     .reporter(reporter)
 *     .build();
 *
 * executor.executeWithRetry("job-42", () -> client.fetchStatusAsync("job-42"))
 *     .thenAccept(outcome -> outcome.onOk(this::render).onFail(this::showError));
 * }</pre>
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryConfig config;
    private final RetryPolicy policy;
    private final CircuitBreaker breaker;
    private final Boundary boundary;
    private final OpReporter reporter;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final ConcurrentMap<String, RetryState> retryStates = new ConcurrentHashMap<>();
    private final LongAdder totalExecutions = new LongAdder();
    private final LongAdder totalAttempts = new LongAdder();
    private final LongAdder totalRetries = new LongAdder();
    private final LongAdder totalSuccesses = new LongAdder();
    private final LongAdder totalFailures = new LongAdder();

    private RetryExecutor(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.reporter = builder.reporter;
        this.scheduler = builder.scheduler;
        this.policy = new RetryPolicy(config, builder.random);
        this.breaker = builder.breaker != null
                ? builder.breaker
                : new CircuitBreaker(config, clock, reporter);
        this.boundary = builder.boundary != null
                ? builder.boundary
                : Boundary.of(new DefaultErrorClassifier(config, clock), reporter);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Executes the operation with the configured per-attempt timeout.
     *
     * @param key The operation key; retry and breaker state are tracked per key
     * @param operation The operation, started once per attempt
     * @return A future completing with Ok or Fail; cancelling it stops further attempts
     */
    public <T> CompletableFuture<Outcome<T>> executeWithRetry(String key, AsyncOperation<T> operation) {
        return executeWithRetry(key, operation, config.fetchTimeout());
    }

    /**
     * Executes the operation with an explicit per-attempt timeout.
     *
     * @param attemptTimeout Deadline for each attempt; null for none
     */
    public <T> CompletableFuture<Outcome<T>> executeWithRetry(String key, AsyncOperation<T> operation,
                                                              Duration attemptTimeout) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        totalExecutions.increment();
        Execution<T> execution = new Execution<>(key, operation, attemptTimeout);
        execution.attempt();
        return execution.result;
    }

    /**
     * Clears the retry state of a key; {@link #getRetryStats} reads attempt 0 afterwards.
     */
    public void resetRetryState(String key) {
        retryStates.remove(key);
    }

    public void resetCircuitBreaker(String key) {
        breaker.reset(key);
    }

    public void resetAllCircuitBreakers() {
        breaker.resetAll();
    }

    public RetryStats getRetryStats(String key) {
        RetryState state = retryStates.get(key);
        return state == null ? RetryStats.none(key, config.maxRetries()) : state.snapshot();
    }

    public ExecutorStats getStats() {
        int openCircuits = (int) breaker.states().values().stream()
                .filter(state -> state.phase() != CircuitPhase.CLOSED)
                .count();
        return new ExecutorStats(
                retryStates.size(),
                openCircuits,
                totalExecutions.sum(),
                totalAttempts.sum(),
                totalRetries.sum(),
                totalSuccesses.sum(),
                totalFailures.sum());
    }

    public CircuitBreaker circuitBreaker() {
        return breaker;
    }

    public RetryConfig config() {
        return config;
    }

    /**
     * One call to {@code executeWithRetry}: its attempts, its pending backoff and its result.
     */
    private final class Execution<T> {
        private final String key;
        private final AsyncOperation<T> operation;
        private final Duration attemptTimeout;
        private final CompletableFuture<Outcome<T>> result = new CompletableFuture<>();

        private RetryContext context = RetryContext.first();
        private volatile ScheduledFuture<?> pendingRetry;
        private volatile boolean holdingTrial;

        private Execution(String key, AsyncOperation<T> operation, Duration attemptTimeout) {
            this.key = key;
            this.operation = operation;
            this.attemptTimeout = attemptTimeout;
            result.whenComplete((outcome, error) -> {
                if (result.isCancelled()) {
                    onCancelled();
                }
            });
        }

        private void attempt() {
            if (result.isDone()) {
                return;
            }
            Admission admission = breaker.acquire(key);
            if (!admission.permitted()) {
                ClassifiedFailure rejected = ClassifiedFailure.circuitOpen(key, clock.instant(), breaker.timeUntilTrial(key));
                reporter.report(rejected);
                finish(Outcome.fail(rejected));
                return;
            }
            holdingTrial = admission == Admission.TRIAL;
            totalAttempts.increment();

            CompletableFuture<T> attempt = new CompletableFuture<>();
            try {
                CompletionStage<T> stage = operation.start();
                if (stage == null) {
                    throw new IllegalStateException("AsyncOperation.start() returned null for [" + key + "]");
                }
                stage.whenComplete((value, error) -> {
                    if (error != null) {
                        attempt.completeExceptionally(error);
                    } else {
                        attempt.complete(value);
                    }
                });
            } catch (Exception e) {
                attempt.completeExceptionally(e);
            }
            if (attemptTimeout != null) {
                attempt.orTimeout(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            attempt.whenComplete((value, error) -> {
                try {
                    if (error == null) {
                        onSuccess(value);
                    } else {
                        onFailure(error);
                    }
                } catch (RuntimeException e) {
                    log.error("Retry bookkeeping failed for [{}]", key, e);
                    finish(Outcome.fail(internalFailure(e)));
                }
            });
        }

        private void onSuccess(T value) {
            holdingTrial = false;
            if (result.isDone()) {
                return;
            }
            breaker.recordSuccess(key);
            retryStates.remove(key);
            finish(Outcome.ok(value));
        }

        private void onFailure(Throwable error) {
            holdingTrial = false;
            if (result.isDone()) {
                return;
            }
            ClassifiedFailure failure = boundary.failure(key, error);
            breaker.recordFailure(key);

            RetryDecision decision = policy.decide(context, failure);
            if (decision instanceof RetryDecision.GiveUp giveUp) {
                RetryState state = retryStates.get(key);
                if (state != null) {
                    state.gaveUp(failure);
                }
                log.debug("Giving up on [{}] after attempt {}: {}", key, context.attemptNumber(), giveUp.reason());
                reporter.reportRetryExhausted(failure, context.attemptNumber());
                finish(Outcome.fail(failure));
                return;
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            retryStates.computeIfAbsent(key, k -> new RetryState(k, config.maxRetries()))
                    .retryScheduled(context.attemptNumber(), delay, failure, clock.instant());
            reporter.reportRetryAttempt(failure, context.attemptNumber(), delay);
            totalRetries.increment();
            context = context.next(delay);

            try {
                pendingRetry = scheduler.schedule(this::attempt, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                finish(Outcome.fail(ClassifiedFailure.builder(ErrorKind.UNKNOWN, "Scheduler rejected retry", key)
                        .retryable(false)
                        .occurredAt(clock.instant())
                        .cause(e)
                        .build()));
                return;
            }
            if (result.isDone()) {
                pendingRetry.cancel(false);
            }
        }

        private void onCancelled() {
            ScheduledFuture<?> pending = pendingRetry;
            if (pending != null) {
                pending.cancel(false);
            }
            if (holdingTrial) {
                holdingTrial = false;
                breaker.abandonTrial(key);
            }
        }

        private void finish(Outcome<T> outcome) {
            if (result.complete(outcome)) {
                if (outcome.isOk()) {
                    totalSuccesses.increment();
                } else {
                    totalFailures.increment();
                }
            }
        }

        private ClassifiedFailure internalFailure(RuntimeException e) {
            return ClassifiedFailure.builder(ErrorKind.UNKNOWN, "Internal failure: " + e, key)
                    .retryable(false)
                    .occurredAt(clock.instant())
                    .cause(e)
                    .build();
        }
    }

    /**
     * Builder for configuring a RetryExecutor.
     */
    public static final class Builder {
        private RetryConfig config = RetryConfig.defaults();
        private ScheduledExecutorService scheduler;
        private OpReporter reporter = OpReporter.noOp();
        private Clock clock = Clock.systemUTC();
        private CircuitBreaker breaker;
        private Boundary boundary;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {}

        public Builder config(RetryConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Sets the scheduler used for backoff waits (required).
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Shares a circuit breaker; by default one is built from the retry configuration.
         */
        public Builder circuitBreaker(CircuitBreaker breaker) {
            this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
            return this;
        }

        /**
         * Sets the boundary that classifies and reports attempt failures.
         */
        public Builder boundary(Boundary boundary) {
            this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
            return this;
        }

        /**
         * Sets the jitter source (package-private, for tests).
         */
        Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random must not be null");
            return this;
        }

        public RetryExecutor build() {
            Objects.requireNonNull(scheduler, "scheduler must be set");
            return new RetryExecutor(this);
        }
    }
}
