package org.javai.pollguard.boundary;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.MutableClock;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DefaultErrorClassifierTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
    private final DefaultErrorClassifier classifier = new DefaultErrorClassifier(false, false, clock);

    @Test
    void classify_serverError_isRetryableServerUnavailable() {
        ClassifiedFailure failure = classifier.classify("job-1", new RemoteStatusException(503, "maintenance"));

        assertThat(failure.kind()).isEqualTo(ErrorKind.SERVER_UNAVAILABLE);
        assertThat(failure.retryable()).isTrue();
        assertThat(failure.statusCode()).hasValue(503);
        assertThat(failure.message()).isEqualTo("HTTP 503: maintenance");
        assertThat(failure.operation()).isEqualTo("job-1");
        assertThat(failure.occurredAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    void classify_clientError_isNotRetryable() {
        ClassifiedFailure failure = classifier.classify("job-1", new RemoteStatusException(404, "no such job"));

        assertThat(failure.kind()).isEqualTo(ErrorKind.CLIENT_REJECTED);
        assertThat(failure.retryable()).isFalse();
        assertThat(failure.statusCode()).hasValue(404);
    }

    @Test
    void classify_retryAfterHint_isCarried() {
        ClassifiedFailure failure = classifier.classify("job-1",
                new RemoteStatusException(429, "slow down", Duration.ofSeconds(7)));

        assertThat(failure.kind()).isEqualTo(ErrorKind.CLIENT_REJECTED);
        assertThat(failure.retryAfter()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void classify_unexpectedStatus_isUnknown() {
        ClassifiedFailure failure = classifier.classify("job-1", new RemoteStatusException(302, "moved"));

        assertThat(failure.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(failure.retryable()).isFalse();
    }

    @Test
    void classify_transportFailures_areRetryableNetwork() {
        assertThat(classifier.classify("op", new ConnectException("refused")).kind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(classifier.classify("op", new UnknownHostException("api.example")).kind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(classifier.classify("op", new IOException("reset")).retryable()).isTrue();
    }

    @Test
    void classify_deadlines_areRetryableTimeouts() {
        assertThat(classifier.classify("op", new SocketTimeoutException("read")).kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(classifier.classify("op", new HttpTimeoutException("request")).kind()).isEqualTo(ErrorKind.TIMEOUT);
        ClassifiedFailure failure = classifier.classify("op", new TimeoutException());
        assertThat(failure.kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(failure.retryable()).isTrue();
        assertThat(failure.message()).isEqualTo("Operation timeout");
    }

    @Test
    void classify_jsonParseFailure_isInvalidData() {
        ObjectMapper mapper = new ObjectMapper();
        Throwable parseFailure = catchThrowable(() -> mapper.readTree("{\"status\": "));

        ClassifiedFailure failure = classifier.classify("job-1", parseFailure);

        assertThat(failure.kind()).isEqualTo(ErrorKind.INVALID_DATA);
        assertThat(failure.retryable()).isFalse();
        assertThat(failure.cause()).isSameAs(parseFailure);
    }

    @Test
    void classify_dateAndNumberParseFailures_areInvalidData() {
        Throwable dateFailure = catchThrowable(() -> LocalDate.parse("yesterday"));
        Throwable numberFailure = catchThrowable(() -> Integer.parseInt("12x"));

        assertThat(dateFailure).isInstanceOf(DateTimeParseException.class);
        assertThat(classifier.classify("op", dateFailure).kind()).isEqualTo(ErrorKind.INVALID_DATA);
        assertThat(classifier.classify("op", numberFailure).kind()).isEqualTo(ErrorKind.INVALID_DATA);
        assertThat(classifier.classify("op", new InvalidDataException("missing status")).kind())
                .isEqualTo(ErrorKind.INVALID_DATA);
    }

    @Test
    void classify_domainFailure_followsConfiguredRetryability() {
        DomainFailureException jobFailed = new DomainFailureException("job crashed");

        assertThat(classifier.classify("op", jobFailed).retryable()).isFalse();
        assertThat(new DefaultErrorClassifier(true, false, clock).classify("op", jobFailed).retryable()).isTrue();
        assertThat(classifier.classify("op", jobFailed).kind()).isEqualTo(ErrorKind.DOMAIN_FAILURE);
    }

    @Test
    void classify_unknown_followsConfiguredRetryability() {
        IllegalStateException bug = new IllegalStateException("bug");

        ClassifiedFailure failure = classifier.classify("op", bug);
        assertThat(failure.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(failure.retryable()).isFalse();
        assertThat(failure.message()).isEqualTo("IllegalStateException: bug");
        assertThat(new DefaultErrorClassifier(false, true, clock).classify("op", bug).retryable()).isTrue();
    }

    @Test
    void classify_unwrapsAsyncWrappers() {
        Throwable wrapped = new CompletionException(new ExecutionException(new ConnectException("refused")));

        ClassifiedFailure failure = classifier.classify("op", wrapped);

        assertThat(failure.kind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(failure.cause()).isInstanceOf(ConnectException.class);
    }

    @Test
    void classify_null_isUnknown() {
        ClassifiedFailure failure = classifier.classify(null, null);

        assertThat(failure.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(failure.operation()).isEqualTo("unknown");
        assertThat(failure.message()).isEqualTo("Unknown failure");
    }

    @Test
    void classify_exceptionThrowingFromGetMessage_stillClassifies() {
        RuntimeException hostile = new RuntimeException() {
            @Override
            public String getMessage() {
                throw new IllegalStateException("no message for you");
            }
        };

        ClassifiedFailure failure = classifier.classify("op", hostile);

        assertThat(failure.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(failure.message()).isEqualTo("Unclassifiable failure");
    }
}
