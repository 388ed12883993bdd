package org.javai.pollguard.ops;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.boundary.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catches uncaught exceptions (defects) on engine threads and reports them to operations.
 *
 * <p>Engine code converts every expected failure into a {@link ClassifiedFailure}; anything
 * that still escapes to the top of a thread is a defect and ends up here.</p>
 *
 * <p>For thread pools:</p>
 * <pre>{@code
 * ScheduledExecutorService executor = Executors.newScheduledThreadPool(2, handler.threadFactory("pollguard", true));
 * }</pre>
 */
public final class OperationalExceptionHandler implements UncaughtExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(OperationalExceptionHandler.class);

    private final ErrorClassifier classifier;
    private final OpReporter reporter;

    public OperationalExceptionHandler(ErrorClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        String operation = "UncaughtException:" + thread.getName();
        log.error("Uncaught exception on thread {}", thread.getName(), throwable);

        ClassifiedFailure failure = classifier.classify(operation, throwable);
        reporter.report(failure);
    }

    /**
     * Installs this handler on a specific thread.
     */
    public void installOn(Thread thread) {
        thread.setUncaughtExceptionHandler(this);
    }

    /**
     * Creates a named ThreadFactory that installs this handler on all created threads.
     * Threads are named {@code <namePrefix>-<n>}, counting from 1.
     */
    public ThreadFactory threadFactory(String namePrefix, boolean daemon) {
        Objects.requireNonNull(namePrefix, "namePrefix must not be null");
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
                thread.setDaemon(daemon);
                thread.setUncaughtExceptionHandler(OperationalExceptionHandler.this);
                return thread;
            }
        };
    }
}
