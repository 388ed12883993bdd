package org.javai.pollguard.recovery;

import java.util.Objects;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.polling.ActivityKind;
import org.javai.pollguard.polling.PollRegistration;
import org.javai.pollguard.polling.PollingListener;
import org.javai.pollguard.polling.PollingScheduler;
import org.javai.pollguard.polling.PollingSession;

/**
 * Adapts a polling registration into a {@link ValueSource}: opening starts a polling session,
 * closing the handle stops it. A terminal value completes the source.
 *
 * <p>The registration's own listener keeps receiving its callbacks ahead of the observer.
 *
 * @param <T> The type of value being polled
 */
public final class PollingSource<T> implements ValueSource<T> {

    private final PollingScheduler scheduler;
    private final PollRegistration<T> registration;

    public PollingSource(PollingScheduler scheduler, PollRegistration<T> registration) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.registration = Objects.requireNonNull(registration, "registration must not be null");
    }

    public String jobId() {
        return registration.jobId();
    }

    @Override
    public SourceHandle open(SourceObserver<T> observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        PollingListener<T> original = registration.listener();
        PollingSession<T> session = scheduler.startPolling(registration.withListener(new PollingListener<>() {
            @Override
            public void onValue(T value, ActivityKind activity) {
                original.onValue(value, activity);
                observer.onValue(value);
            }

            @Override
            public void onError(ClassifiedFailure failure) {
                original.onError(failure);
                observer.onError(failure);
            }

            @Override
            public void onTerminal(T value) {
                original.onTerminal(value);
                observer.onComplete();
            }
        }));
        return session::close;
    }
}
