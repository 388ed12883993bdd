package org.javai.pollguard.ops.log4j;

import java.time.Duration;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.pollguard.Cause;
import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.breaker.CircuitPhase;
import org.javai.pollguard.ops.OpReporter;
import org.javai.pollguard.polling.SessionCloseReason;
import org.javai.pollguard.recovery.Health;

/**
 * Reports engine events using Log4j2 structured logging.
 *
 * <p>Failures are logged at a level derived from their classification:
 * <ul>
 *   <li>retryable failures → INFO (they are expected and absorbed)</li>
 *   <li>circuit-open rejections → DEBUG (the breaker transition is already logged)</li>
 *   <li>everything else → WARN</li>
 * </ul>
 *
 * <p>Each event type carries its own marker ({@code FAILURE}, {@code RETRY},
 * {@code RETRY_EXHAUSTED}, {@code CIRCUIT}, {@code HEALTH}, {@code SESSION}) so that
 * appenders can route them separately.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker CIRCUIT_MARKER = MarkerManager.getMarker("CIRCUIT");
	static final Marker HEALTH_MARKER = MarkerManager.getMarker("HEALTH");
	static final Marker SESSION_MARKER = MarkerManager.getMarker("SESSION");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.pollguard.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(ClassifiedFailure failure) {
		logger.atLevel(levelFor(failure))
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(ClassifiedFailure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry after attempt {} for operation [{}] in {} ms. Kind: {}, Message: {}",
				attemptNumber,
				failure.operation(),
				delay.toMillis(),
				failure.kind(),
				failure.message());
	}

	@Override
	public void reportRetryExhausted(ClassifiedFailure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Giving up on operation [{}] after {} attempts. Kind: {}, Retryable: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				failure.kind(),
				failure.retryable(),
				failure.message());
	}

	@Override
	public void reportCircuitTransition(String key, CircuitPhase from, CircuitPhase to, int consecutiveFailures) {
		Level level = to == CircuitPhase.OPEN ? Level.WARN : Level.INFO;
		logger.atLevel(level)
			.withMarker(CIRCUIT_MARKER)
			.log("Circuit [{}] {} -> {} (consecutive failures: {})", key, from, to, consecutiveFailures);
	}

	@Override
	public void reportHealthTransition(String streamId, Health previous, Health current) {
		Level level = switch (current.state()) {
			case HEALTHY -> Level.INFO;
			case DEGRADED -> Level.WARN;
			case UNHEALTHY -> Level.ERROR;
		};
		logger.atLevel(level)
			.withMarker(HEALTH_MARKER)
			.log("Stream [{}] health {} -> {} (consecutive failures: {}{})",
				streamId,
				previous.state(),
				current.state(),
				current.consecutiveFailures(),
				current.lastError().map(e -> ", last error: " + e.kind()).orElse(""));
	}

	@Override
	public void reportSessionStarted(String jobId) {
		logger.atDebug()
			.withMarker(SESSION_MARKER)
			.log("Polling session [{}] started", jobId);
	}

	@Override
	public void reportSessionClosed(String jobId, SessionCloseReason reason) {
		Level level = reason == SessionCloseReason.CALLBACK_FAILED ? Level.WARN : Level.INFO;
		logger.atLevel(level)
			.withMarker(SESSION_MARKER)
			.log("Polling session [{}] closed: {}", jobId, reason);
	}

	private String formatFailureMessage(ClassifiedFailure failure) {
		return """
			Failure in operation [%s]: %s \
			| kind=%s, retryable=%s%s%s%s\
			""".formatted(
				failure.operation(),
				failure.message(),
				failure.kind(),
				failure.retryable(),
				failure.statusCode().isPresent() ? ", status=" + failure.statusCode().getAsInt() : "",
				failure.retryAfter() != null ? ", retryAfter=" + failure.retryAfter() : "",
				formatCause(failure.diagnosticCause())
			).trim();
	}

	private static String formatCause(Cause cause) {
		return cause != null ? ", cause=" + cause.type() : "";
	}

	private static Level levelFor(ClassifiedFailure failure) {
		if (failure.kind() == ErrorKind.CIRCUIT_OPEN) {
			return Level.DEBUG;
		}
		return failure.retryable() ? Level.INFO : Level.WARN;
	}
}
