package org.javai.pollguard.ops.metrics;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.breaker.CircuitPhase;
import org.javai.pollguard.ops.OpReporter;
import org.javai.pollguard.polling.SessionCloseReason;
import org.javai.pollguard.recovery.Health;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports engine events as JSON-lines metrics via SLF4J.
 *
 * <p>Every event becomes one JSON object on one log line, suitable for metrics aggregation.
 * The tracking key is the operation key, prefixed with an optional namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"pollguard.job-42","attemptNumber":1,"delayMs":500,"kind":"NETWORK"}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.pollguard.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final JsonFactory JSON = new JsonFactory();

	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(ClassifiedFailure failure) {
		emit(failure.operation(), "failure", failure.occurredAt(), json -> {
			json.writeStringField("kind", failure.kind().name());
			json.writeBooleanField("retryable", failure.retryable());
			json.writeStringField("message", failure.message());
			if (failure.statusCode().isPresent()) {
				json.writeNumberField("statusCode", failure.statusCode().getAsInt());
			}
			if (failure.retryAfter() != null) {
				json.writeNumberField("retryAfterMs", failure.retryAfter().toMillis());
			}
		});
	}

	@Override
	public void reportRetryAttempt(ClassifiedFailure failure, int attemptNumber, Duration delay) {
		emit(failure.operation(), "retry_attempt", failure.occurredAt(), json -> {
			json.writeNumberField("attemptNumber", attemptNumber);
			json.writeNumberField("delayMs", delay.toMillis());
			json.writeStringField("kind", failure.kind().name());
		});
	}

	@Override
	public void reportRetryExhausted(ClassifiedFailure failure, int totalAttempts) {
		emit(failure.operation(), "retry_exhausted", failure.occurredAt(), json -> {
			json.writeNumberField("totalAttempts", totalAttempts);
			json.writeStringField("kind", failure.kind().name());
			json.writeBooleanField("retryable", failure.retryable());
		});
	}

	@Override
	public void reportCircuitTransition(String key, CircuitPhase from, CircuitPhase to, int consecutiveFailures) {
		emit(key, "circuit_transition", Instant.now(), json -> {
			json.writeStringField("from", from.name());
			json.writeStringField("to", to.name());
			json.writeNumberField("consecutiveFailures", consecutiveFailures);
		});
	}

	@Override
	public void reportHealthTransition(String streamId, Health previous, Health current) {
		emit(streamId, "health_transition", current.changedAt(), json -> {
			json.writeStringField("from", previous.state().name());
			json.writeStringField("to", current.state().name());
			json.writeNumberField("consecutiveFailures", current.consecutiveFailures());
		});
	}

	@Override
	public void reportSessionStarted(String jobId) {
		emit(jobId, "session_started", Instant.now(), json -> {});
	}

	@Override
	public void reportSessionClosed(String jobId, SessionCloseReason reason) {
		emit(jobId, "session_closed", Instant.now(), json -> json.writeStringField("reason", reason.name()));
	}

	String buildTrackingKey(String key) {
		if (namespace == null) {
			return key;
		}
		return namespace + "." + key;
	}

	private void emit(String key, String eventType, Instant at, Fields fields) {
		try {
			StringWriter out = new StringWriter();
			try (JsonGenerator json = JSON.createGenerator(out)) {
				json.writeStartObject();
				json.writeStringField("eventType", eventType);
				json.writeStringField("timestamp", ISO_FORMATTER.format(at));
				json.writeStringField("trackingKey", buildTrackingKey(key));
				fields.write(json);
				json.writeEndObject();
			}
			logger.info(out.toString());
		} catch (IOException | RuntimeException e) {
			logger.debug("Unable to emit {} metric for [{}]", eventType, key, e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	@FunctionalInterface
	private interface Fields {
		void write(JsonGenerator json) throws IOException;
	}
}
