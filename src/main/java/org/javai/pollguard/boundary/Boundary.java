package org.javai.pollguard.boundary;

import java.util.Objects;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.Outcome;
import org.javai.pollguard.ops.OpReporter;

/**
 * The single point where raw exceptions are translated into {@link ClassifiedFailure} values.
 * Classifies, reports, and hands back a value; after passing through a Boundary, code
 * operates entirely in outcome-space.
 *
 * <p>For synchronous calls, RuntimeExceptions the classifier does not recognise (it answers
 * {@code UNKNOWN}) are treated as defects and propagate, to be handled by
 * {@link org.javai.pollguard.ops.OperationalExceptionHandler} at the top of the stack.
 * Recognised ones, such as {@link NumberFormatException} while parsing a payload, become
 * {@code INVALID_DATA} failures.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(myReporter);
 *
 * Outcome<JobStatus> status = boundary.call(
 *     "job-42",
 *     () -> client.fetchStatus("job-42")
 * );
 * }</pre>
 */
public final class Boundary {

    private final ErrorClassifier classifier;
    private final OpReporter reporter;

    /**
     * Creates a silent Boundary that classifies failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(new DefaultErrorClassifier(), OpReporter.noOp());
    }

    /**
     * Creates a Boundary with default classification and the specified reporter.
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(new DefaultErrorClassifier(), reporter);
    }

    /**
     * Creates a Boundary with custom classification and reporting.
     */
    public static Boundary of(ErrorClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(ErrorClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into an Outcome.
     *
     * @param operation The operation key for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            ClassifiedFailure failure = classifier.classify(operation, e);
            if (failure.kind() == ErrorKind.UNKNOWN) {
                // Defects propagate; they are not operational failures.
                throw e;
            }
            reporter.report(failure);
            return Outcome.fail(failure);
        } catch (Exception e) {
            return Outcome.fail(failure(operation, e));
        }
    }

    /**
     * Classifies and reports a failure observed outside {@link #call}, typically the
     * exceptional completion of an asynchronous attempt.
     *
     * @param operation The operation key
     * @param throwable The raw failure (may be null)
     * @return The classified failure, already reported
     */
    public ClassifiedFailure failure(String operation, Throwable throwable) {
        ClassifiedFailure failure = classifier.classify(operation, throwable);
        reporter.report(failure);
        return failure;
    }

    public ErrorClassifier classifier() {
        return classifier;
    }
}
