package org.javai.pollguard.recovery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.boundary.ErrorClassifier;
import org.javai.pollguard.config.RecoveryConfig;
import org.javai.pollguard.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A value source wrapped with a recovery strategy, exposing a value channel and a health channel.
 *
 * <p>All source events, timers and deliveries of one stream run on the stream's own
 * single-threaded loop, so at most one re-establishment is ever in flight and subscribers of
 * one stream are never called concurrently. A health change is published before the value
 * event caused by the same source event.
 *
 * <p>The strategy applied to a source error is chosen by the error's kind, falling back to the
 * configured strategy; an escalation from RETRY holds until the next value.
 *
 * <p>Subscriber exceptions are logged and reported; they never stop the loop. A value is held
 * back for replay only when no value subscriber accepted it, so no subscriber sees a value twice.
 *
 * @param <T> The type of value carried
 */
public final class ResilientStream<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientStream.class);

    private final String streamId;
    private final ValueSource<T> source;
    private final RecoveryConfig config;
    private final T fallback;
    private final ErrorClassifier classifier;
    private final OpReporter reporter;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor loop;
    private final Consumer<ResilientStream<?>> onClosed;

    private final List<Consumer<StreamEvent<T>>> valueSubscribers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Health>> healthSubscribers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    // confined to the loop thread
    private SourceHandle handle;
    private long generation;
    private RecoveryStrategy activeStrategy;
    private boolean escalated;
    private int reestablishAttempts;
    private int reestablishments;
    private Instant lastReestablishAt;
    private boolean recovering;
    private Instant breakerOpenUntil;
    private ScheduledFuture<?> pending;
    private T lastGood;
    private boolean hasLastGood;
    private final Deque<T> buffer = new ArrayDeque<>();
    private long dropped;

    // written on the loop, read anywhere
    private volatile Health health;
    private volatile RecoveryStats stats;

    ResilientStream(String streamId, ValueSource<T> source, RecoveryConfig config, T fallback,
                    ErrorClassifier classifier, OpReporter reporter, Clock clock,
                    ThreadFactory threadFactory, Consumer<ResilientStream<?>> onClosed) {
        this.streamId = streamId;
        this.source = source;
        this.config = config;
        this.fallback = fallback;
        this.classifier = classifier;
        this.reporter = reporter;
        this.clock = clock;
        this.onClosed = onClosed;
        this.activeStrategy = config.strategy();
        this.health = Health.healthy(clock.instant());
        this.loop = new ScheduledThreadPoolExecutor(1, threadFactory);
        this.loop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.loop.setRemoveOnCancelPolicy(true);
        refreshStats();
    }

    void start() {
        post(this::openSource);
    }

    public String id() {
        return streamId;
    }

    /**
     * Subscribes to the value channel.
     *
     * @return a subscription whose {@code close()} unsubscribes
     */
    public Subscription subscribe(Consumer<StreamEvent<T>> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        valueSubscribers.add(subscriber);
        return () -> valueSubscribers.remove(subscriber);
    }

    /**
     * Subscribes to the health channel. The subscriber receives the current health right away,
     * then every change.
     */
    public Subscription subscribeHealth(Consumer<Health> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        healthSubscribers.add(subscriber);
        post(() -> notify(subscriber, health, "health"));
        return () -> healthSubscribers.remove(subscriber);
    }

    public Health health() {
        return health;
    }

    public RecoveryStats getRecoveryStats() {
        return stats;
    }

    /**
     * Clears retry counters, the buffer and any escalation. A pending cool-down or re-open is
     * cut short and the source is re-opened right away.
     */
    public void resetRecoveryState() {
        post(() -> {
            reestablishAttempts = 0;
            reestablishments = 0;
            lastReestablishAt = null;
            activeStrategy = config.strategy();
            escalated = false;
            buffer.clear();
            dropped = 0;
            breakerOpenUntil = null;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
                openSource();
            }
        });
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the source and stops the loop. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            loop.execute(this::shutdownOnLoop);
        } catch (RejectedExecutionException e) {
            log.debug("Stream [{}] loop already stopped", streamId);
        }
        loop.shutdown();
        onClosed.accept(this);
    }

    // --- loop ---

    private void shutdownOnLoop() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        closeSource();
        valueSubscribers.clear();
        healthSubscribers.clear();
        refreshStats();
    }

    private void openSource() {
        if (closed.get()) {
            return;
        }
        long gen = ++generation;
        try {
            handle = source.open(new SourceObserver<>() {
                @Override
                public void onValue(T value) {
                    post(() -> handleValue(gen, value));
                }

                @Override
                public void onError(ClassifiedFailure failure) {
                    post(() -> handleError(gen, failure));
                }

                @Override
                public void onComplete() {
                    post(() -> handleComplete(gen));
                }
            });
        } catch (RuntimeException e) {
            log.warn("Stream [{}] could not open its source", streamId, e);
            ClassifiedFailure failure = classifier.classify(streamId, e);
            reporter.report(failure);
            post(() -> handleError(gen, failure));
        }
    }

    private void closeSource() {
        generation++;
        SourceHandle current = handle;
        handle = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("Stream [{}] failed to close its source", streamId, e);
            }
        }
    }

    private void handleValue(long gen, T value) {
        if (closed.get() || gen != generation) {
            return;
        }
        reestablishAttempts = 0;
        recovering = false;
        breakerOpenUntil = null;
        activeStrategy = config.strategy();
        escalated = false;
        lastGood = value;
        hasLastGood = true;

        publishHealth(Health.healthy(clock.instant()));

        if (!buffer.isEmpty()) {
            replayBuffer();
        }
        if (buffer.isEmpty()) {
            if (!deliver(new StreamEvent.Item<>(value, StreamEvent.Origin.LIVE))) {
                bufferIfEnabled(value);
            }
        } else {
            // keep order: live values queue behind what could not be replayed
            bufferIfEnabled(value);
        }
    }

    private void handleError(long gen, ClassifiedFailure failure) {
        if (closed.get() || gen != generation) {
            return;
        }
        Instant now = clock.instant();
        publishHealth(health.afterError(failure, config.unhealthyThreshold(), now));

        RecoveryStrategy strategy = escalated ? activeStrategy : config.strategyFor(failure.kind());
        activeStrategy = strategy;
        switch (strategy) {
            case RETRY -> {
                if (reestablishAttempts >= config.maxReestablishments()) {
                    activeStrategy = RecoveryStrategy.RETRY.escalation();
                    escalated = true;
                    log.info("Stream [{}] escalates from RETRY to {} after {} re-establishments",
                            streamId, activeStrategy, reestablishAttempts);
                    breakCircuitOrReestablish(now);
                } else {
                    scheduleReestablish(config.reestablishDelay(++reestablishAttempts));
                }
            }
            case CIRCUIT_BREAKING -> breakCircuitOrReestablish(now);
            case FALLBACK -> {
                if (fallback != null) {
                    deliver(new StreamEvent.Item<>(fallback, StreamEvent.Origin.FALLBACK));
                } else if (hasLastGood) {
                    deliver(new StreamEvent.Item<>(lastGood, StreamEvent.Origin.FALLBACK));
                }
            }
            case BUFFER -> log.debug("Stream [{}] absorbs {} while buffering", streamId, failure.kind());
            case DEGRADED -> deliver(StreamEvent.Heartbeat.of(now, health));
            default -> throw new IllegalStateException("Unexpected strategy: " + strategy);
        }
    }

    private void handleComplete(long gen) {
        if (closed.get() || gen != generation) {
            return;
        }
        deliver(new StreamEvent.Completed<>());
        close();
    }

    private void breakCircuitOrReestablish(Instant now) {
        if (health.consecutiveFailures() > config.recoveryFailureThreshold()) {
            Duration cooldown = config.recoveryCooldown();
            breakerOpenUntil = now.plus(cooldown);
            log.warn("Stream [{}] cools down for {} after {} consecutive errors",
                    streamId, cooldown, health.consecutiveFailures());
            scheduleReestablish(cooldown);
        } else {
            scheduleReestablish(config.reestablishDelay(++reestablishAttempts));
        }
    }

    private void scheduleReestablish(Duration delay) {
        closeSource();
        recovering = true;
        if (pending != null) {
            return;
        }
        try {
            pending = loop.schedule(() -> guarded(this::reestablish), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Stream [{}] loop stopped before re-establishment", streamId);
        }
    }

    private void reestablish() {
        pending = null;
        if (closed.get()) {
            return;
        }
        reestablishments++;
        lastReestablishAt = clock.instant();
        breakerOpenUntil = null;
        log.debug("Stream [{}] re-establishes its source (#{})", streamId, reestablishments);
        openSource();
    }

    private void replayBuffer() {
        while (!buffer.isEmpty()) {
            T next = buffer.peekFirst();
            if (!deliver(new StreamEvent.Item<>(next, StreamEvent.Origin.REPLAYED))) {
                return;
            }
            buffer.pollFirst();
        }
    }

    private void bufferIfEnabled(T value) {
        if (!config.usesStrategy(RecoveryStrategy.BUFFER)) {
            return;
        }
        if (buffer.size() >= config.bufferCapacity()) {
            buffer.pollFirst();
            dropped++;
        }
        buffer.addLast(value);
    }

    /**
     * @return true if at least one subscriber accepted the event
     */
    private boolean deliver(StreamEvent<T> event) {
        boolean accepted = false;
        for (Consumer<StreamEvent<T>> subscriber : valueSubscribers) {
            accepted |= notify(subscriber, event, "value");
        }
        return accepted;
    }

    private void publishHealth(Health next) {
        Health previous = health;
        if (next.sameAs(previous)) {
            return;
        }
        health = next;
        for (Consumer<Health> subscriber : healthSubscribers) {
            notify(subscriber, next, "health");
        }
        if (previous.state() != next.state()) {
            reporter.reportHealthTransition(streamId, previous, next);
        }
    }

    private <E> boolean notify(Consumer<E> subscriber, E event, String channel) {
        try {
            subscriber.accept(event);
            return true;
        } catch (RuntimeException e) {
            log.warn("Stream [{}] {} subscriber threw", streamId, channel, e);
            reporter.report(classifier.classify(streamId, e));
            return false;
        }
    }

    private void post(Runnable task) {
        try {
            loop.execute(() -> guarded(task));
        } catch (RejectedExecutionException e) {
            log.trace("Stream [{}] closed, dropping event", streamId);
        }
    }

    private void guarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Stream [{}] loop task failed", streamId, e);
        } finally {
            refreshStats();
        }
    }

    private void refreshStats() {
        stats = new RecoveryStats(streamId, config.strategy(), activeStrategy, reestablishments,
                Optional.ofNullable(lastReestablishAt), recovering, buffer.size(), dropped,
                Optional.ofNullable(breakerOpenUntil), health);
    }

    /**
     * A channel subscription; closing it unsubscribes.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
