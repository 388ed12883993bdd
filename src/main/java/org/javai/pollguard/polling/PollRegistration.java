package org.javai.pollguard.polling;

import java.util.Objects;
import java.util.function.Predicate;

import org.javai.pollguard.config.PollingConfig;
import org.javai.pollguard.retry.AsyncOperation;

/**
 * Everything the scheduler needs to poll one job.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * PollRegistration<JobStatus> registration = PollRegistration.builder("job-42", () -> client.statusAsync("job-42"))
 *     .terminalWhen(JobStatus::isFinished)
 *     .listener(listener)
 *     .build();
 * }</pre>
 *
 * @param <T> The type of value being polled
 */
public final class PollRegistration<T> {

    private final String jobId;
    private final AsyncOperation<T> fetch;
    private final ActivityClassifier<T> classifier;
    private final Predicate<? super T> terminal;
    private final PollingListener<T> listener;
    private final PollingConfig config;

    private PollRegistration(Builder<T> builder) {
        this.jobId = builder.jobId;
        this.fetch = builder.fetch;
        this.classifier = builder.classifier;
        this.terminal = builder.terminal;
        this.listener = builder.listener;
        this.config = builder.config;
    }

    public static <T> Builder<T> builder(String jobId, AsyncOperation<T> fetch) {
        return new Builder<>(jobId, fetch);
    }

    public String jobId() {
        return jobId;
    }

    public AsyncOperation<T> fetch() {
        return fetch;
    }

    public ActivityClassifier<T> classifier() {
        return classifier;
    }

    public Predicate<? super T> terminal() {
        return terminal;
    }

    public PollingListener<T> listener() {
        return listener;
    }

    /**
     * Per-job cadence override, or null to use the scheduler's configuration.
     */
    public PollingConfig config() {
        return config;
    }

    /**
     * Returns a copy delivering to a different listener.
     */
    public PollRegistration<T> withListener(PollingListener<T> listener) {
        return toBuilder().listener(listener).build();
    }

    public Builder<T> toBuilder() {
        Builder<T> builder = new Builder<>(jobId, fetch);
        builder.classifier = classifier;
        builder.terminal = terminal;
        builder.listener = listener;
        builder.config = config;
        return builder;
    }

    public static final class Builder<T> {
        private final String jobId;
        private final AsyncOperation<T> fetch;
        private ActivityClassifier<T> classifier = ActivityClassifier.byEquality();
        private Predicate<? super T> terminal = value -> false;
        private PollingListener<T> listener = PollingListener.noOp();
        private PollingConfig config;

        private Builder(String jobId, AsyncOperation<T> fetch) {
            this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
            this.fetch = Objects.requireNonNull(fetch, "fetch must not be null");
            if (jobId.isBlank()) {
                throw new IllegalArgumentException("jobId must not be blank");
            }
        }

        public Builder<T> classifier(ActivityClassifier<T> classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the predicate that marks a value as final. Default: never.
         */
        public Builder<T> terminalWhen(Predicate<? super T> terminal) {
            this.terminal = Objects.requireNonNull(terminal, "terminal must not be null");
            return this;
        }

        public Builder<T> listener(PollingListener<T> listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        public Builder<T> config(PollingConfig config) {
            this.config = config;
            return this;
        }

        public PollRegistration<T> build() {
            return new PollRegistration<>(this);
        }
    }
}
