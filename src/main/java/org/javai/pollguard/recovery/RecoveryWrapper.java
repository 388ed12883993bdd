package org.javai.pollguard.recovery;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import org.javai.pollguard.boundary.ErrorClassifier;
import org.javai.pollguard.config.RecoveryConfig;
import org.javai.pollguard.ops.OpReporter;

/**
 * Wraps value sources into {@link ResilientStream}s that share one recovery configuration.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResilientStream<JobStatus> stream = wrapper.wrap("job-42", new PollingSource<>(scheduler, registration), null);
 * stream.subscribe(event -> ...);
 * stream.subscribeHealth(health -> ...);
 * }</pre>
 */
public final class RecoveryWrapper implements AutoCloseable {

    private final RecoveryConfig config;
    private final OpReporter reporter;
    private final Clock clock;
    private final ThreadFactory threadFactory;
    private final ErrorClassifier classifier;

    private final AtomicLong streamCounter = new AtomicLong();
    private final ConcurrentMap<String, ResilientStream<?>> streams = new ConcurrentHashMap<>();

    public RecoveryWrapper(RecoveryConfig config, OpReporter reporter, Clock clock,
                           ThreadFactory threadFactory, ErrorClassifier classifier) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public <T> ResilientStream<T> wrap(ValueSource<T> source) {
        return wrap(null, source, null);
    }

    public <T> ResilientStream<T> wrap(ValueSource<T> source, T fallback) {
        return wrap(null, source, fallback);
    }

    /**
     * Wraps a source and opens it.
     *
     * @param streamId identifier used in logs, reports and stats; {@code stream-<n>} when null
     * @param source the source to protect
     * @param fallback value emitted on error under {@link RecoveryStrategy#FALLBACK} (may be null)
     * @throws IllegalArgumentException if a stream with the same id is still open
     */
    public <T> ResilientStream<T> wrap(String streamId, ValueSource<T> source, T fallback) {
        Objects.requireNonNull(source, "source must not be null");
        String id = streamId != null ? streamId : "stream-" + streamCounter.incrementAndGet();
        ResilientStream<T> stream = new ResilientStream<>(id, source, config, fallback, classifier, reporter,
                clock, threadFactory, closed -> streams.remove(closed.id(), closed));
        if (streams.putIfAbsent(id, stream) != null) {
            throw new IllegalArgumentException("Stream [" + id + "] is already open");
        }
        stream.start();
        return stream;
    }

    public List<ResilientStream<?>> openStreams() {
        return List.copyOf(streams.values());
    }

    public RecoveryConfig config() {
        return config;
    }

    /**
     * Closes every open stream.
     */
    public void closeAll() {
        for (ResilientStream<?> stream : streams.values()) {
            stream.close();
        }
    }

    @Override
    public void close() {
        closeAll();
    }
}
