package org.javai.pollguard.boundary;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.config.RetryConfig;

/**
 * Classifies the failures a status fetch typically produces: JDK networking and timeout
 * exceptions, the fetch collaborator exceptions of this package, and parse failures.
 *
 * <p>Wrapper exceptions from asynchronous pipelines ({@link CompletionException},
 * {@link ExecutionException}) are unwrapped before classification.
 *
 * <p>{@code DOMAIN_FAILURE} and {@code UNKNOWN} are retryable only when the
 * corresponding {@link RetryConfig} flag is set.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    private static final int MAX_UNWRAP_DEPTH = 16;

    private final boolean retryDomainFailures;
    private final boolean retryUnknownFailures;
    private final Clock clock;

    public DefaultErrorClassifier() {
        this(false, false, Clock.systemUTC());
    }

    public DefaultErrorClassifier(RetryConfig config, Clock clock) {
        this(config.retryDomainFailures(), config.retryUnknownFailures(), clock);
    }

    public DefaultErrorClassifier(boolean retryDomainFailures, boolean retryUnknownFailures, Clock clock) {
        this.retryDomainFailures = retryDomainFailures;
        this.retryUnknownFailures = retryUnknownFailures;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ClassifiedFailure classify(String operation, Throwable throwable) {
        String op = operation != null ? operation : "unknown";
        try {
            return doClassify(op, unwrap(throwable));
        } catch (RuntimeException e) {
            // A misbehaving exception (e.g. a throwing getMessage) still classifies.
            return failure(ErrorKind.UNKNOWN, retryUnknownFailures, "Unclassifiable failure", op, throwable);
        }
    }

    private ClassifiedFailure doClassify(String operation, Throwable t) {
        if (t == null) {
            return failure(ErrorKind.UNKNOWN, retryUnknownFailures, "Unknown failure", operation, null);
        }

        // Remote service answered
        if (t instanceof RemoteStatusException remote) {
            return classifyStatus(operation, remote);
        }

        if (t instanceof DomainFailureException) {
            return failure(ErrorKind.DOMAIN_FAILURE, retryDomainFailures, messageFor("Remote job failed", t), operation, t);
        }

        // Payload problems; JsonProcessingException is an IOException so this runs first
        if (t instanceof InvalidDataException
                || t instanceof JsonProcessingException
                || t instanceof DateTimeParseException
                || t instanceof NumberFormatException
                || t instanceof ClassCastException) {
            return failure(ErrorKind.INVALID_DATA, false, messageFor("Invalid data", t), operation, t);
        }

        // Deadlines
        if (t instanceof SocketTimeoutException) {
            return failure(ErrorKind.TIMEOUT, true, messageFor("Socket timeout", t), operation, t);
        }
        if (t instanceof HttpTimeoutException) {
            return failure(ErrorKind.TIMEOUT, true, messageFor("HTTP timeout", t), operation, t);
        }
        if (t instanceof TimeoutException) {
            return failure(ErrorKind.TIMEOUT, true, messageFor("Operation timeout", t), operation, t);
        }

        // Transport
        if (t instanceof ConnectException) {
            return failure(ErrorKind.NETWORK, true, messageFor("Connection refused", t), operation, t);
        }
        if (t instanceof UnknownHostException) {
            return failure(ErrorKind.NETWORK, true, messageFor("Unknown host", t), operation, t);
        }
        if (t instanceof NoRouteToHostException) {
            return failure(ErrorKind.NETWORK, true, messageFor("No route to host", t), operation, t);
        }
        if (t instanceof SocketException) {
            return failure(ErrorKind.NETWORK, true, messageFor("Socket error", t), operation, t);
        }
        if (t instanceof IOException) {
            return failure(ErrorKind.NETWORK, true, messageFor("IO error", t), operation, t);
        }

        return failure(ErrorKind.UNKNOWN, retryUnknownFailures, messageFor(t.getClass().getSimpleName(), t), operation, t);
    }

    private ClassifiedFailure classifyStatus(String operation, RemoteStatusException e) {
        int status = e.statusCode();
        ErrorKind kind;
        boolean retryable;
        if (status >= 500 && status <= 599) {
            kind = ErrorKind.SERVER_UNAVAILABLE;
            retryable = true;
        } else if (status >= 400 && status <= 499) {
            kind = ErrorKind.CLIENT_REJECTED;
            retryable = false;
        } else {
            kind = ErrorKind.UNKNOWN;
            retryable = retryUnknownFailures;
        }
        return ClassifiedFailure.builder(kind, messageFor("HTTP " + status, e), operation)
                .retryable(retryable)
                .statusCode(status)
                .occurredAt(clock.instant())
                .cause(e)
                .retryAfter(e.retryAfter())
                .build();
    }

    private ClassifiedFailure failure(ErrorKind kind, boolean retryable, String message, String operation, Throwable cause) {
        return ClassifiedFailure.builder(kind, message, operation)
                .retryable(retryable)
                .occurredAt(clock.instant())
                .cause(cause)
                .build();
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        int depth = 0;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null
                && depth++ < MAX_UNWRAP_DEPTH) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageFor(String prefix, Throwable t) {
        String detail = t.getMessage();
        return detail != null ? prefix + ": " + detail : prefix;
    }
}
