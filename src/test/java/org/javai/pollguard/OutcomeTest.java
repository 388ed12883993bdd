package org.javai.pollguard;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OutcomeTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void ok_holdsValue() {
        Outcome<String> outcome = Outcome.ok("done");

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.isFail()).isFalse();
        assertThat(outcome.getOrThrow()).isEqualTo("done");
        assertThat(outcome.getOrElse("other")).isEqualTo("done");
    }

    @Test
    void fail_getOrThrow_throwsWithFailure() {
        ClassifiedFailure failure = timeout();
        Outcome<String> outcome = Outcome.fail(failure);

        assertThatThrownBy(outcome::getOrThrow)
                .isInstanceOf(OutcomeFailedException.class)
                .satisfies(e -> assertThat(((OutcomeFailedException) e).failure()).isSameAs(failure));
    }

    @Test
    void fail_getOrElse_returnsDefault() {
        Outcome<String> outcome = Outcome.fail(timeout());

        assertThat(outcome.getOrElse("fallback")).isEqualTo("fallback");
        assertThat(outcome.getOrElseGet(() -> "computed")).isEqualTo("computed");
    }

    @Test
    void map_transformsOkAndCarriesFailure() {
        assertThat(Outcome.ok(21).map(v -> v * 2).getOrThrow()).isEqualTo(42);

        ClassifiedFailure failure = timeout();
        Outcome<Integer> mapped = Outcome.<Integer>fail(failure).map(v -> v * 2);
        assertThat(mapped).isEqualTo(Outcome.fail(failure));
    }

    @Test
    void flatMap_chainsOutcomes() {
        Outcome<Integer> result = Outcome.ok("42").flatMap(s -> Outcome.ok(Integer.parseInt(s)));

        assertThat(result.getOrThrow()).isEqualTo(42);
    }

    @Test
    void recover_turnsFailIntoOk() {
        Outcome<String> recovered = Outcome.<String>fail(timeout()).recover(f -> "recovered from " + f.kind());

        assertThat(recovered.getOrThrow()).isEqualTo("recovered from TIMEOUT");
    }

    @Test
    void onOkAndOnFail_runOnlyForMatchingSide() {
        List<String> seen = new ArrayList<>();

        Outcome.ok("v").onOk(seen::add).onFail(f -> seen.add("fail"));
        Outcome.<String>fail(timeout()).onOk(seen::add).onFail(f -> seen.add("fail"));

        assertThat(seen).containsExactly("v", "fail");
    }

    @Test
    void circuitOpen_isNotRetryableAndCarriesWait() {
        ClassifiedFailure failure = ClassifiedFailure.circuitOpen("job-1", NOW, Duration.ofSeconds(5));

        assertThat(failure.kind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(failure.retryable()).isFalse();
        assertThat(failure.retryAfter()).hasSeconds(5);
        assertThat(failure.cause()).isNull();
        assertThat(failure.diagnosticCause()).isNull();
    }

    @Test
    void builder_defaultsRetryabilityFromKind() {
        assertThat(ClassifiedFailure.builder(ErrorKind.NETWORK, "m", "op").build().retryable()).isTrue();
        assertThat(ClassifiedFailure.builder(ErrorKind.CLIENT_REJECTED, "m", "op").build().retryable()).isFalse();
    }

    @Test
    void withOperation_rebindsKey() {
        ClassifiedFailure failure = timeout().withOperation("job-2");

        assertThat(failure.operation()).isEqualTo("job-2");
        assertThat(failure.kind()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    void diagnosticCause_describesException() {
        ClassifiedFailure failure = ClassifiedFailure.builder(ErrorKind.NETWORK, "refused", "op")
                .cause(new ConnectException("refused"))
                .build();

        Cause cause = failure.diagnosticCause();
        assertThat(cause.type()).isEqualTo("java.net.ConnectException");
        assertThat(cause.detail()).isEqualTo("refused");
        assertThat(cause.fingerprint()).startsWith("ConnectException@");
    }

    private static ClassifiedFailure timeout() {
        return ClassifiedFailure.builder(ErrorKind.TIMEOUT, "timed out", "job-1").occurredAt(NOW).build();
    }
}
