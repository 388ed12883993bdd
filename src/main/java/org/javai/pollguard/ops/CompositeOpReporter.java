package org.javai.pollguard.ops;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.breaker.CircuitPhase;
import org.javai.pollguard.polling.SessionCloseReason;
import org.javai.pollguard.recovery.Health;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("pollguard"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(ClassifiedFailure failure) {
		fanOut("report", reporter -> reporter.report(failure));
	}

	@Override
	public void reportRetryAttempt(ClassifiedFailure failure, int attemptNumber, Duration delay) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(failure, attemptNumber, delay));
	}

	@Override
	public void reportRetryExhausted(ClassifiedFailure failure, int totalAttempts) {
		fanOut("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(failure, totalAttempts));
	}

	@Override
	public void reportCircuitTransition(String key, CircuitPhase from, CircuitPhase to, int consecutiveFailures) {
		fanOut("reportCircuitTransition",
				reporter -> reporter.reportCircuitTransition(key, from, to, consecutiveFailures));
	}

	@Override
	public void reportHealthTransition(String streamId, Health previous, Health current) {
		fanOut("reportHealthTransition", reporter -> reporter.reportHealthTransition(streamId, previous, current));
	}

	@Override
	public void reportSessionStarted(String jobId) {
		fanOut("reportSessionStarted", reporter -> reporter.reportSessionStarted(jobId));
	}

	@Override
	public void reportSessionClosed(String jobId, SessionCloseReason reason) {
		fanOut("reportSessionClosed", reporter -> reporter.reportSessionClosed(jobId, reason));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				log.warn("OpReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite; null is ignored.
		 */
		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends OpReporter> reporters) {
			for (OpReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 */
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
