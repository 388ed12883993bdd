package org.javai.pollguard.polling;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.RecordingOpReporter;
import org.javai.pollguard.RecordingOpReporter.SessionClosed;
import org.javai.pollguard.boundary.RemoteStatusException;
import org.javai.pollguard.config.PollingConfig;
import org.javai.pollguard.config.RetryConfig;
import org.javai.pollguard.retry.AsyncOperation;
import org.javai.pollguard.retry.RetryExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class PollingSchedulerTest {

    private static final PollingConfig FAST = PollingConfig.builder()
            .minInterval(Duration.ofMillis(20))
            .maxInterval(Duration.ofMillis(200))
            .inactivityThreshold(0)
            .growthFactor(2.0)
            .build();

    private static final RetryConfig NO_RETRY = RetryConfig.builder()
            .maxRetries(0)
            .initialDelay(Duration.ofMillis(10))
            .jitterFactor(0.0)
            .fetchTimeout(Duration.ofSeconds(2))
            .failureThreshold(100)
            .build();

    private ScheduledThreadPoolExecutor executor;
    private RecordingOpReporter reporter;
    private PollingScheduler scheduler;
    private RecordingListener<String> listener;

    @BeforeEach
    void setUp() {
        executor = new ScheduledThreadPoolExecutor(2);
        reporter = new RecordingOpReporter();
        RetryExecutor retryExecutor = RetryExecutor.builder()
                .config(NO_RETRY)
                .scheduler(executor)
                .reporter(reporter)
                .build();
        scheduler = new PollingScheduler(FAST, retryExecutor, executor, reporter, Clock.systemUTC());
        listener = new RecordingListener<>();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        executor.shutdownNow();
    }

    @Test
    void startPolling_firstTickFiresImmediately() {
        AtomicInteger calls = new AtomicInteger();

        scheduler.startPolling(registration("job-1", AsyncOperation.blocking(() -> {
            calls.incrementAndGet();
            return "RUNNING";
        })));

        await().atMost(Duration.ofMillis(500)).until(() -> !listener.values.isEmpty());
        assertThat(listener.values.get(0)).isEqualTo("RUNNING");
        assertThat(listener.activities.get(0)).isEqualTo(ActivityKind.STATUS_CHANGED);
        assertThat(scheduler.isPolling("job-1")).isTrue();
        assertThat(reporter.sessionsStarted).containsExactly("job-1");
    }

    @Test
    void unchangedValues_growIntervalUpToMax() {
        scheduler.startPolling(registration("job-1", AsyncOperation.blocking(() -> "RUNNING")));

        await().atMost(Duration.ofSeconds(3))
                .until(() -> scheduler.getMetrics("job-1").orElseThrow().currentInterval().equals(FAST.maxInterval()));
        PollingMetrics metrics = scheduler.getMetrics("job-1").orElseThrow();
        assertThat(metrics.count(ActivityKind.STATUS_CHANGED)).isEqualTo(1);
        assertThat(metrics.count(ActivityKind.NO_CHANGE)).isPositive();
    }

    @Test
    void terminalValue_deliversTerminalAndClosesSession() {
        scheduler.startPolling(registration("job-1", sequence("PENDING", "RUNNING", "DONE")));

        await().atMost(Duration.ofSeconds(2)).until(() -> !scheduler.isPolling("job-1"));
        assertThat(listener.values).containsExactly("PENDING", "RUNNING", "DONE");
        assertThat(listener.terminals).containsExactly("DONE");
        assertThat(reporter.sessionsClosed).containsExactly(new SessionClosed("job-1", SessionCloseReason.TERMINAL));

        PollingMetrics metrics = scheduler.getMetrics("job-1").orElseThrow();
        assertThat(metrics.isActive()).isFalse();
        assertThat(metrics.successes()).isEqualTo(3);
        assertThat(metrics.successRate()).isEqualTo(1.0);
    }

    @Test
    void stopPolling_discardsInFlightResult() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();
        scheduler.startPolling(registration("job-1", () -> {
            calls.incrementAndGet();
            return pending;
        }));
        await().atMost(Duration.ofMillis(500)).until(() -> calls.get() == 1);

        assertThat(scheduler.stopPolling("job-1")).isTrue();
        pending.complete("RUNNING");

        await().during(Duration.ofMillis(150)).atMost(Duration.ofMillis(500))
                .until(() -> listener.values.isEmpty() && listener.terminals.isEmpty());
        assertThat(calls.get()).isEqualTo(1);
        assertThat(scheduler.stopPolling("job-1")).isFalse();
        assertThat(reporter.sessionsClosed).containsExactly(new SessionClosed("job-1", SessionCloseReason.STOPPED));
    }

    @Test
    void startPolling_sameJob_replacesPreviousSession() {
        PollingSession<String> first = scheduler.startPolling(registration("job-1", AsyncOperation.blocking(() -> "A")));
        PollingSession<String> second = scheduler.startPolling(registration("job-1", AsyncOperation.blocking(() -> "B")));

        assertThat(first.isClosed()).isTrue();
        assertThat(second.isClosed()).isFalse();
        assertThat(scheduler.activeJobs()).containsExactly("job-1");
        assertThat(reporter.sessionsClosed).containsExactly(new SessionClosed("job-1", SessionCloseReason.REPLACED));
    }

    @Test
    void sessionTimeout_reportsTimeoutAndCloses() {
        PollRegistration<String> registration = registration("job-1", AsyncOperation.blocking(() -> "RUNNING"))
                .toBuilder()
                .config(FAST.toBuilder().sessionTimeout(Duration.ofMillis(100)).build())
                .build();

        scheduler.startPolling(registration);

        await().atMost(Duration.ofSeconds(2)).until(() -> !scheduler.isPolling("job-1"));
        assertThat(listener.errors).singleElement()
                .extracting(ClassifiedFailure::kind)
                .isEqualTo(ErrorKind.TIMEOUT);
        assertThat(reporter.sessionsClosed)
                .containsExactly(new SessionClosed("job-1", SessionCloseReason.DEADLINE_EXCEEDED));
    }

    @Test
    void permanentFailure_deliversErrorAndKeepsPolling() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.startPolling(registration("job-1", AsyncOperation.<String>blocking(() -> {
            calls.incrementAndGet();
            throw new RemoteStatusException(404, "no such job");
        })));

        await().atMost(Duration.ofSeconds(2)).until(() -> listener.errors.size() >= 3);
        assertThat(listener.errors).extracting(ClassifiedFailure::kind).containsOnly(ErrorKind.CLIENT_REJECTED);
        assertThat(scheduler.isPolling("job-1")).isTrue();
        PollingMetrics metrics = scheduler.getMetrics("job-1").orElseThrow();
        assertThat(metrics.errors()).isGreaterThanOrEqualTo(3);
        assertThat(metrics.currentInterval()).isGreaterThan(FAST.minInterval());
    }

    @Test
    void throwingListener_doesNotStopSession() {
        AtomicInteger deliveries = new AtomicInteger();
        PollRegistration<String> registration = PollRegistration.builder("job-1", AsyncOperation.blocking(() -> "RUNNING"))
                .listener((value, activity) -> {
                    deliveries.incrementAndGet();
                    throw new IllegalStateException("listener bug");
                })
                .build();

        scheduler.startPolling(registration);

        await().atMost(Duration.ofSeconds(2)).until(() -> deliveries.get() >= 2);
        assertThat(scheduler.isPolling("job-1")).isTrue();
        assertThat(reporter.failures).extracting(ClassifiedFailure::message)
                .anySatisfy(message -> assertThat(message).startsWith("onValue threw"));
    }

    @Test
    void throwingClassifier_closesSession() {
        PollRegistration<String> registration = registration("job-1", AsyncOperation.blocking(() -> "RUNNING"))
                .toBuilder()
                .classifier((previous, next) -> {
                    throw new IllegalArgumentException("cannot compare");
                })
                .build();

        scheduler.startPolling(registration);

        await().atMost(Duration.ofSeconds(2)).until(() -> !scheduler.isPolling("job-1"));
        assertThat(listener.values).isEmpty();
        assertThat(reporter.sessionsClosed)
                .containsExactly(new SessionClosed("job-1", SessionCloseReason.CALLBACK_FAILED));
    }

    @Test
    void recordActivity_resetsIntervalAndCountsHint() {
        assertThat(scheduler.recordActivity("unknown", ActivityKind.WAIT_TRIGGERED)).isFalse();
        scheduler.startPolling(registration("job-1", AsyncOperation.blocking(() -> "RUNNING")));
        await().atMost(Duration.ofSeconds(3))
                .until(() -> scheduler.getMetrics("job-1").orElseThrow().currentInterval().equals(FAST.maxInterval()));

        assertThat(scheduler.recordActivity("job-1", ActivityKind.WAIT_TRIGGERED)).isTrue();

        PollingMetrics metrics = scheduler.getMetrics("job-1").orElseThrow();
        assertThat(metrics.count(ActivityKind.WAIT_TRIGGERED)).isEqualTo(1);
        assertThat(metrics.lastActivityKind()).isPresent();
        assertThat(metrics.lastActivityAt()).isPresent();
    }

    @Test
    void getMetrics_retainedAfterStopUntilForgotten() {
        scheduler.startPolling(registration("job-1", AsyncOperation.blocking(() -> "RUNNING")));
        await().atMost(Duration.ofMillis(500)).until(() -> !listener.values.isEmpty());

        scheduler.stopPolling("job-1");

        assertThat(scheduler.getMetrics("job-1")).hasValueSatisfying(m -> assertThat(m.endedAt()).isPresent());
        scheduler.forgetMetrics("job-1");
        assertThat(scheduler.getMetrics("job-1")).isEmpty();
    }

    @Test
    void getOverallStats_aggregatesSessions() {
        scheduler.startPolling(registration("job-1", sequence("DONE")));
        scheduler.startPolling(registration("job-2", AsyncOperation.blocking(() -> "RUNNING")));
        await().atMost(Duration.ofSeconds(1))
                .until(() -> !scheduler.isPolling("job-1") && scheduler.getOverallStats().totalSuccesses() >= 2);

        PollingStats stats = scheduler.getOverallStats();
        assertThat(stats.totalSessions()).isEqualTo(2);
        assertThat(stats.activeSessions()).isEqualTo(1);
        assertThat(stats.totalSuccesses()).isGreaterThanOrEqualTo(2);
        assertThat(stats.totalErrors()).isZero();
    }

    @Test
    void close_stopsEverythingAndRejectsNewJobs() {
        scheduler.startPolling(registration("job-1", AsyncOperation.blocking(() -> "RUNNING")));
        scheduler.startPolling(registration("job-2", AsyncOperation.blocking(() -> "RUNNING")));

        scheduler.close();

        assertThat(scheduler.isClosed()).isTrue();
        assertThat(scheduler.activeJobs()).isEmpty();
        assertThat(reporter.sessionsClosed).extracting(SessionClosed::reason)
                .containsOnly(SessionCloseReason.SHUTDOWN);
        assertThatThrownBy(() -> scheduler.startPolling(registration("job-3", AsyncOperation.blocking(() -> "x"))))
                .isInstanceOf(IllegalStateException.class);
    }

    private PollRegistration<String> registration(String jobId, AsyncOperation<String> fetch) {
        return PollRegistration.builder(jobId, fetch)
                .terminalWhen("DONE"::equals)
                .listener(listener)
                .build();
    }

    private static AsyncOperation<String> sequence(String... values) {
        List<String> remaining = new CopyOnWriteArrayList<>(List.of(values));
        AtomicReference<String> last = new AtomicReference<>();
        return AsyncOperation.blocking(() -> {
            if (!remaining.isEmpty()) {
                last.set(remaining.remove(0));
            }
            return last.get();
        });
    }

    static final class RecordingListener<T> implements PollingListener<T> {
        final List<T> values = new CopyOnWriteArrayList<>();
        final List<ActivityKind> activities = new CopyOnWriteArrayList<>();
        final List<ClassifiedFailure> errors = new CopyOnWriteArrayList<>();
        final List<T> terminals = new CopyOnWriteArrayList<>();

        @Override
        public void onValue(T value, ActivityKind activity) {
            values.add(value);
            activities.add(activity);
        }

        @Override
        public void onError(ClassifiedFailure failure) {
            errors.add(failure);
        }

        @Override
        public void onTerminal(T value) {
            terminals.add(value);
        }
    }
}
