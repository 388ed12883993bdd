package org.javai.pollguard.polling;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.config.PollingConfig;
import org.javai.pollguard.ops.OpReporter;
import org.javai.pollguard.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls many jobs concurrently, each on its own adaptive cadence.
 *
 * <p>Every tick runs the job's fetch through the {@link RetryExecutor}, so transient failures
 * are retried before a tick counts as failed, and an open circuit breaker pushes the next
 * tick out to the moment the breaker admits a trial.
 *
 * <p>Sessions are independent: the registry is a concurrent map and each session has its own
 * lock. The scheduler does not own the {@link ScheduledExecutorService} it runs on.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * scheduler.startPolling(PollRegistration.builder("job-42", fetch)
 *     .terminalWhen(JobStatus::isFinished)
 *     .listener(listener)
 *     .build());
 * ...
 * scheduler.stopPolling("job-42");
 * }</pre>
 */
public final class PollingScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    private final PollingConfig config;
    private final RetryExecutor executor;
    private final ScheduledExecutorService scheduler;
    private final OpReporter reporter;
    private final Clock clock;

    private final ConcurrentMap<String, PollingSession<?>> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PollingMetrics> endedMetrics = new ConcurrentHashMap<>();
    private final LongAdder totalSessions = new LongAdder();
    private final LongAdder totalAttempts = new LongAdder();
    private final LongAdder totalSuccesses = new LongAdder();
    private final LongAdder totalErrors = new LongAdder();
    private volatile boolean closed;

    public PollingScheduler(PollingConfig config, RetryExecutor executor, ScheduledExecutorService scheduler,
                            OpReporter reporter, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts polling a job. The first tick fires immediately. A session already polling the
     * same job id is closed and replaced.
     *
     * @throws IllegalStateException if the scheduler has been closed
     */
    public <T> PollingSession<T> startPolling(PollRegistration<T> registration) {
        Objects.requireNonNull(registration, "registration must not be null");
        if (closed) {
            throw new IllegalStateException("PollingScheduler is closed");
        }
        String jobId = registration.jobId();
        PollingConfig effective = registration.config() != null ? registration.config() : config;
        PollingSession<T> session = new PollingSession<>(this, registration, new IntervalPolicy(effective), clock);

        PollingSession<?> previous = sessions.put(jobId, session);
        if (previous != null) {
            previous.close(SessionCloseReason.REPLACED);
        }
        endedMetrics.remove(jobId);
        totalSessions.increment();
        reporter.reportSessionStarted(jobId);
        session.start();
        if (closed) {
            session.close(SessionCloseReason.SHUTDOWN);
        }
        return session;
    }

    /**
     * Stops polling a job. No listener call for it happens after this returns.
     *
     * @return true if a session was active
     */
    public boolean stopPolling(String jobId) {
        PollingSession<?> session = sessions.get(jobId);
        if (session == null) {
            return false;
        }
        session.close(SessionCloseReason.STOPPED);
        return true;
    }

    public void stopAll() {
        closeAll(SessionCloseReason.STOPPED);
    }

    public boolean isPolling(String jobId) {
        return sessions.containsKey(jobId);
    }

    public Set<String> activeJobs() {
        return Set.copyOf(sessions.keySet());
    }

    /**
     * Feeds an external activity hint into a job's cadence, as if it had been observed.
     *
     * @return false if the job is not being polled
     */
    public boolean recordActivity(String jobId, ActivityKind kind) {
        PollingSession<?> session = sessions.get(jobId);
        return session != null && session.recordActivity(kind);
    }

    /**
     * Metrics of the active session for a job, or of its last ended session.
     */
    public Optional<PollingMetrics> getMetrics(String jobId) {
        PollingSession<?> session = sessions.get(jobId);
        if (session != null) {
            return Optional.of(session.metrics());
        }
        return Optional.ofNullable(endedMetrics.get(jobId));
    }

    /**
     * Drops the retained metrics of an ended session.
     */
    public void forgetMetrics(String jobId) {
        endedMetrics.remove(jobId);
    }

    public PollingStats getOverallStats() {
        return new PollingStats(
                totalSessions.sum(),
                sessions.size(),
                totalAttempts.sum(),
                totalSuccesses.sum(),
                totalErrors.sum());
    }

    /**
     * Closes every session and rejects further registrations. Idempotent.
     */
    @Override
    public void close() {
        closed = true;
        closeAll(SessionCloseReason.SHUTDOWN);
    }

    public boolean isClosed() {
        return closed;
    }

    private void closeAll(SessionCloseReason reason) {
        for (PollingSession<?> session : sessions.values()) {
            session.close(reason);
        }
    }

    // --- session callbacks ---

    RetryExecutor executor() {
        return executor;
    }

    Duration fetchTimeout() {
        return executor.config().fetchTimeout();
    }

    /**
     * Schedules a session task, or returns null when the executor no longer accepts work.
     */
    ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        long millis = Math.max(0L, delay.toMillis());
        try {
            return scheduler.schedule(() -> runGuarded(task), millis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler rejected polling task", e);
            return null;
        }
    }

    void sessionClosed(PollingSession<?> session, SessionCloseReason reason, PollingMetrics finalMetrics) {
        String jobId = session.jobId();
        sessions.remove(jobId, session);
        endedMetrics.put(jobId, finalMetrics);
        executor.resetRetryState(jobId);
        log.debug("Polling session [{}] closed: {}", jobId, reason);
        reporter.reportSessionClosed(jobId, reason);
    }

    void attemptStarted() {
        totalAttempts.increment();
    }

    void succeeded() {
        totalSuccesses.increment();
    }

    void failed() {
        totalErrors.increment();
    }

    void reportCallbackFailure(String jobId, String callback, RuntimeException e) {
        reporter.report(ClassifiedFailure.builder(ErrorKind.UNKNOWN, callback + " threw: " + e, jobId)
                .retryable(false)
                .occurredAt(clock.instant())
                .cause(e)
                .build());
    }

    /**
     * Tasks on a ScheduledExecutorService swallow their exceptions into the future; route them
     * to the thread's uncaught-exception handler instead.
     */
    private static void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException | Error e) {
            Thread current = Thread.currentThread();
            current.getUncaughtExceptionHandler().uncaughtException(current, e);
        }
    }
}
