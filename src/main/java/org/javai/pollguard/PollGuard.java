package org.javai.pollguard;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.javai.pollguard.boundary.Boundary;
import org.javai.pollguard.boundary.DefaultErrorClassifier;
import org.javai.pollguard.boundary.ErrorClassifier;
import org.javai.pollguard.breaker.CircuitBreaker;
import org.javai.pollguard.config.EngineConfig;
import org.javai.pollguard.ops.OpReporter;
import org.javai.pollguard.ops.OperationalExceptionHandler;
import org.javai.pollguard.polling.PollRegistration;
import org.javai.pollguard.polling.PollingScheduler;
import org.javai.pollguard.recovery.PollingSource;
import org.javai.pollguard.recovery.RecoveryWrapper;
import org.javai.pollguard.recovery.ResilientStream;
import org.javai.pollguard.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine together: one classifier, one circuit breaker, one retry executor, one
 * polling scheduler and one recovery wrapper, all sharing a reporter, a clock and a daemon
 * thread pool whose uncaught exceptions are reported as defects.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * try (PollGuard guard = PollGuard.builder()
 *         .config(EngineConfig.load())
 *         .reporter(new Log4jOpReporter())
 *         .build()) {
 *     ResilientStream<JobStatus> stream = guard.watch(registration, null);
 *     stream.subscribe(event -> ...);
 * }
 * }</pre>
 */
public final class PollGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PollGuard.class);

    private final EngineConfig config;
    private final ScheduledThreadPoolExecutor executor;
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final PollingScheduler scheduler;
    private final RecoveryWrapper recoveryWrapper;
    private volatile boolean closed;

    private PollGuard(EngineConfig config, OpReporter reporter, Clock clock, ErrorClassifier classifier) {
        this.config = config;
        OperationalExceptionHandler handler = new OperationalExceptionHandler(classifier, reporter);

        this.executor = new ScheduledThreadPoolExecutor(config.schedulerThreads(), handler.threadFactory("pollguard", true));
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        this.circuitBreaker = new CircuitBreaker(config.retry(), clock, reporter);
        this.retryExecutor = RetryExecutor.builder()
                .config(config.retry())
                .scheduler(executor)
                .reporter(reporter)
                .clock(clock)
                .circuitBreaker(circuitBreaker)
                .boundary(Boundary.of(classifier, reporter))
                .build();
        this.scheduler = new PollingScheduler(config.polling(), retryExecutor, executor, reporter, clock);
        this.recoveryWrapper = new RecoveryWrapper(config.recovery(), reporter, clock,
                handler.threadFactory("pollguard-stream", true), classifier);
        log.debug("PollGuard started with {} scheduler threads", config.schedulerThreads());
    }

    /**
     * Creates an engine with default settings and no reporting.
     */
    public static PollGuard create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts polling a job and wraps it in a resilient stream named after the job.
     *
     * @param registration the job to poll
     * @param fallback value emitted on error under the fallback strategy (may be null)
     * @throws IllegalStateException if the engine has been closed
     */
    public <T> ResilientStream<T> watch(PollRegistration<T> registration, T fallback) {
        Objects.requireNonNull(registration, "registration must not be null");
        ensureOpen();
        return recoveryWrapper.wrap(registration.jobId(), new PollingSource<>(scheduler, registration), fallback);
    }

    public PollingScheduler scheduler() {
        ensureOpen();
        return scheduler;
    }

    public RetryExecutor retryExecutor() {
        ensureOpen();
        return retryExecutor;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public RecoveryWrapper recoveryWrapper() {
        ensureOpen();
        return recoveryWrapper;
    }

    public EngineConfig config() {
        return config;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes every stream and session, then stops the thread pool. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        recoveryWrapper.closeAll();
        scheduler.close();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("PollGuard thread pool did not stop within 5 seconds");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("PollGuard closed");
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PollGuard is closed");
        }
    }

    public static final class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private OpReporter reporter = OpReporter.noOp();
        private Clock clock = Clock.systemUTC();
        private ErrorClassifier classifier;

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
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
         * Replaces the default classifier, which is built from the retry settings.
         */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public PollGuard build() {
            ErrorClassifier effective = classifier != null
                    ? classifier
                    : new DefaultErrorClassifier(config.retry(), clock);
            return new PollGuard(config, reporter, clock, effective);
        }
    }
}
