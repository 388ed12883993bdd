package org.javai.pollguard.retry;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.CompressingScheduler;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.MutableClock;
import org.javai.pollguard.Outcome;
import org.javai.pollguard.RecordingOpReporter;
import org.javai.pollguard.boundary.RemoteStatusException;
import org.javai.pollguard.breaker.CircuitPhase;
import org.javai.pollguard.config.RetryConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class RetryExecutorTest {

    private static final RetryConfig CONFIG = RetryConfig.builder()
            .maxRetries(3)
            .initialDelay(Duration.ofSeconds(1))
            .backoffMultiplier(2.0)
            .maxDelay(Duration.ofSeconds(10))
            .jitterFactor(0.0)
            .failureThreshold(10)
            .resetTimeout(Duration.ofSeconds(30))
            .build();

    private CompressingScheduler scheduler;
    private MutableClock clock;
    private RecordingOpReporter reporter;
    private RetryExecutor executor;
    private final AtomicInteger invocations = new AtomicInteger();
    private RetryExecutor sharedExecutor;

    @BeforeEach
    void setUp() {
        scheduler = new CompressingScheduler();
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        reporter = new RecordingOpReporter();
        executor = executorWith(CONFIG);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void execute_success_returnsOkWithoutRetries() {
        Outcome<String> result = executor.executeWithRetry("job-1", AsyncOperation.blocking(() -> "RUNNING")).join();

        assertThat(result.getOrThrow()).isEqualTo("RUNNING");
        assertThat(reporter.retries).isEmpty();
        assertThat(executor.getRetryStats("job-1").attempt()).isZero();
    }

    @Test
    void execute_threeTimeoutsThenSuccess_backsOffOneTwoFourSeconds() {
        AtomicInteger calls = new AtomicInteger();

        Outcome<String> result = executor.executeWithRetry("job-1", AsyncOperation.blocking(() -> {
            if (calls.incrementAndGet() <= 3) {
                throw new SocketTimeoutException("read timed out");
            }
            return "SUCCEEDED";
        })).join();

        assertThat(result.getOrThrow()).isEqualTo("SUCCEEDED");
        assertThat(calls.get()).isEqualTo(4);
        assertThat(scheduler.requestedDelays())
                .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
        assertThat(reporter.retryDelays())
                .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
        assertThat(reporter.retries).extracting(RecordingOpReporter.RetryAttempt::attemptNumber)
                .containsExactly(1, 2, 3);
        assertThat(executor.getRetryStats("job-1").attempt()).isZero();
    }

    @Test
    void execute_persistentTransientFailure_invokesAtMostMaxRetriesPlusOne() {
        AtomicInteger calls = new AtomicInteger();

        Outcome<String> result = executor.executeWithRetry("job-1", AsyncOperation.<String>blocking(() -> {
            calls.incrementAndGet();
            throw new ConnectException("refused");
        })).join();

        assertThat(result.isFail()).isTrue();
        assertThat(((Outcome.Fail<String>) result).failure().kind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(calls.get()).isEqualTo(4);
        assertThat(reporter.exhausted).singleElement()
                .extracting(RecordingOpReporter.RetryExhausted::totalAttempts)
                .isEqualTo(4);

        RetryStats stats = executor.getRetryStats("job-1");
        assertThat(stats.attempt()).isEqualTo(3);
        assertThat(stats.exhausted()).isTrue();
        assertThat(stats.lastFailure()).isPresent();
    }

    @Test
    void execute_nonRetryableFailure_surfacesImmediately() {
        AtomicInteger calls = new AtomicInteger();

        Outcome<String> result = executor.executeWithRetry("job-1", AsyncOperation.<String>blocking(() -> {
            calls.incrementAndGet();
            throw new RemoteStatusException(404, "no such job");
        })).join();

        ClassifiedFailure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.kind()).isEqualTo(ErrorKind.CLIENT_REJECTED);
        assertThat(failure.statusCode()).hasValue(404);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(reporter.retries).isEmpty();
        assertThat(reporter.failures).containsExactly(failure);
    }

    @Test
    void execute_exceptionallyCompletedStage_isClassified() {
        Outcome<String> result = executor.executeWithRetry("job-1",
                () -> CompletableFuture.<String>failedFuture(new RemoteStatusException(400, "bad request"))).join();

        assertThat(((Outcome.Fail<String>) result).failure().kind()).isEqualTo(ErrorKind.CLIENT_REJECTED);
    }

    @Test
    void execute_openCircuit_rejectsWithoutInvoking() {
        executor = executorWith(CONFIG.toBuilder().maxRetries(0).failureThreshold(2).build());
        AtomicInteger calls = new AtomicInteger();
        AsyncOperation<String> failing = AsyncOperation.blocking(() -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        });

        executor.executeWithRetry("job-1", failing).join();
        executor.executeWithRetry("job-1", failing).join();
        clock.advance(Duration.ofSeconds(10));
        Outcome<String> rejected = executor.executeWithRetry("job-1", failing).join();

        assertThat(calls.get()).isEqualTo(2);
        ClassifiedFailure failure = ((Outcome.Fail<String>) rejected).failure();
        assertThat(failure.kind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(failure.retryable()).isFalse();
        assertThat(failure.retryAfter()).isEqualTo(Duration.ofSeconds(20));
        assertThat(executor.getStats().openCircuits()).isEqualTo(1);
    }

    @Test
    void execute_afterResetTimeout_trialSuccessClosesCircuit() {
        executor = executorWith(CONFIG.toBuilder().maxRetries(0).failureThreshold(2).build());
        AsyncOperation<String> failing = AsyncOperation.blocking(() -> {
            throw new IOException("connection reset");
        });
        executor.executeWithRetry("job-1", failing).join();
        executor.executeWithRetry("job-1", failing).join();

        clock.advance(Duration.ofSeconds(30));
        Outcome<String> trial = executor.executeWithRetry("job-1", AsyncOperation.blocking(() -> "back")).join();

        assertThat(trial.getOrThrow()).isEqualTo("back");
        assertThat(executor.circuitBreaker().state("job-1").phase()).isEqualTo(CircuitPhase.CLOSED);
        assertThat(executor.circuitBreaker().state("job-1").consecutiveFailures()).isZero();
    }

    @Test
    void execute_keysDoNotShareRetryState() {
        executor.executeWithRetry("job-1", AsyncOperation.blocking(() -> {
            throw new ConnectException("refused");
        })).join();

        assertThat(executor.getRetryStats("job-1").attempt()).isEqualTo(3);
        assertThat(executor.getRetryStats("job-2").attempt()).isZero();
    }

    @Test
    void execute_attemptTimeout_isClassifiedAsTimeout() throws Exception {
        CompletableFuture<String> never = new CompletableFuture<>();
        RetryExecutor noRetries = executorWith(CONFIG.toBuilder().maxRetries(0).build());

        Outcome<String> result = noRetries.executeWithRetry("job-1", () -> never, Duration.ofMillis(50))
                .get(5, TimeUnit.SECONDS);

        assertThat(((Outcome.Fail<String>) result).failure().kind()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    void cancel_stopsFurtherAttempts() throws Exception {
        ScheduledExecutorService realScheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            RetryExecutor slow = RetryExecutor.builder()
                    .config(CONFIG.toBuilder().initialDelay(Duration.ofMillis(200)).build())
                    .scheduler(realScheduler)
                    .reporter(reporter)
                    .clock(clock)
                    .build();
            AtomicInteger calls = new AtomicInteger();

            CompletableFuture<Outcome<String>> result = slow.executeWithRetry("job-1", AsyncOperation.blocking(() -> {
                calls.incrementAndGet();
                throw new ConnectException("refused");
            }));
            result.cancel(false);
            Thread.sleep(500);

            assertThat(result).isCancelled();
            assertThat(calls.get()).isEqualTo(1);
        } finally {
            realScheduler.shutdownNow();
        }
    }

    @Test
    void resetRetryState_clearsAttempt() {
        executor.executeWithRetry("job-1", AsyncOperation.blocking(() -> {
            throw new ConnectException("refused");
        })).join();

        executor.resetRetryState("job-1");

        assertThat(executor.getRetryStats("job-1")).isEqualTo(RetryStats.none("job-1", 3));
    }

    @Test
    void getStats_countsExecutionsAndAttempts() {
        AtomicInteger calls = new AtomicInteger();
        executor.executeWithRetry("job-1", AsyncOperation.blocking(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new ConnectException("refused");
            }
            return "ok";
        })).join();
        executor.executeWithRetry("job-2", AsyncOperation.blocking(() -> {
            throw new RemoteStatusException(404, "gone");
        })).join();

        ExecutorStats stats = executor.getStats();
        assertThat(stats.totalExecutions()).isEqualTo(2);
        assertThat(stats.totalAttempts()).isEqualTo(3);
        assertThat(stats.totalRetries()).isEqualTo(1);
        assertThat(stats.totalSuccesses()).isEqualTo(1);
        assertThat(stats.totalFailures()).isEqualTo(1);
    }

    @Test
    void execute_asyncOperationOnExecutor_completesOffThread() {
        CompletableFuture<Outcome<String>> result = executor.executeWithRetry("job-1",
                AsyncOperation.blocking(() -> Thread.currentThread().getName(), scheduler));

        await().atMost(Duration.ofSeconds(2)).until(result::isDone);
        assertThat(result.join().getOrThrow()).isNotEqualTo(Thread.currentThread().getName());
    }

    @Test
    void concurrentCallersOnOneKey_neverExceedAttemptBudget() throws Exception {
        RetryConfig config = CONFIG.toBuilder()
                .maxRetries(2)
                .initialDelay(Duration.ofMillis(5))
                .maxDelay(Duration.ofMillis(50))
                .jitterFactor(0.2)
                .failureThreshold(1_000)
                .build();

        List<Outcome<String>> outcomes = executeConcurrently(config, 8);

        assertThat(outcomes).hasSize(8).allMatch(Outcome::isFail);
        assertThat(outcomes).extracting(outcome -> ((Outcome.Fail<String>) outcome).failure().kind())
                .containsOnly(ErrorKind.NETWORK);
        assertThat(invocations.get()).isEqualTo(8 * 3);
        assertThat(sharedExecutor.getRetryStats("shared").attempt()).isEqualTo(2);
        assertThat(sharedExecutor.getStats().totalRetries()).isEqualTo(8 * 2);
    }

    @Test
    void concurrentCallersOnOneKey_breakerOpeningMidwayCapsInvocations() throws Exception {
        RetryConfig config = CONFIG.toBuilder()
                .maxRetries(2)
                .initialDelay(Duration.ofMillis(5))
                .maxDelay(Duration.ofMillis(50))
                .failureThreshold(4)
                .resetTimeout(Duration.ofMinutes(5))
                .build();

        List<Outcome<String>> outcomes = executeConcurrently(config, 8);

        assertThat(outcomes).hasSize(8).allMatch(Outcome::isFail);
        assertThat(invocations.get()).isBetween(4, 8 * 3);
        assertThat(sharedExecutor.getRetryStats("shared").attempt()).isLessThanOrEqualTo(2);
        assertThat(sharedExecutor.circuitBreaker().state("shared").phase()).isEqualTo(CircuitPhase.OPEN);
        assertThat(outcomes).extracting(outcome -> ((Outcome.Fail<String>) outcome).failure().kind())
                .contains(ErrorKind.CIRCUIT_OPEN)
                .containsOnly(ErrorKind.NETWORK, ErrorKind.CIRCUIT_OPEN);
    }

    private List<Outcome<String>> executeConcurrently(RetryConfig config, int callers) throws Exception {
        ScheduledThreadPoolExecutor timers = new ScheduledThreadPoolExecutor(4);
        ExecutorService callerPool = Executors.newFixedThreadPool(callers);
        sharedExecutor = RetryExecutor.builder()
                .config(config)
                .scheduler(timers)
                .reporter(reporter)
                .clock(Clock.systemUTC())
                .build();
        AsyncOperation<String> failing = AsyncOperation.blocking(() -> {
            invocations.incrementAndGet();
            throw new ConnectException("connection refused");
        }, timers);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<Outcome<String>>> futures = new CopyOnWriteArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                callerPool.execute(() -> {
                    try {
                        start.await();
                        futures.add(sharedExecutor.executeWithRetry("shared", failing));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            await().atMost(Duration.ofSeconds(5)).until(() -> futures.size() == callers);
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(5, TimeUnit.SECONDS);
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            callerPool.shutdownNow();
            timers.shutdownNow();
        }
    }

    private RetryExecutor executorWith(RetryConfig config) {
        return RetryExecutor.builder()
                .config(config)
                .scheduler(scheduler)
                .reporter(reporter)
                .clock(clock)
                .build();
    }
}
