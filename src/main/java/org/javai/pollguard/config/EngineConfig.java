package org.javai.pollguard.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.recovery.RecoveryStrategy;

/**
 * The full configuration bundle consumed by {@link org.javai.pollguard.PollGuard}.
 *
 * <p>Invalid values are rejected here, at construction time, so a running engine never
 * discovers a configuration problem mid-flight.
 *
 * @param polling Scheduler cadence settings
 * @param retry Retry and circuit-breaker settings
 * @param recovery Recovery wrapper settings
 * @param schedulerThreads Size of the shared scheduler pool
 */
public record EngineConfig(
        PollingConfig polling,
        RetryConfig retry,
        RecoveryConfig recovery,
        int schedulerThreads
) {

    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "pollguard.properties";

    private static final String PREFIX = "pollguard.";

    public EngineConfig {
        Objects.requireNonNull(polling, "polling must not be null");
        Objects.requireNonNull(retry, "retry must not be null");
        Objects.requireNonNull(recovery, "recovery must not be null");
        ConfigChecks.atLeast(schedulerThreads, 1, "schedulerThreads");
    }

    public static EngineConfig defaults() {
        return new EngineConfig(PollingConfig.defaults(), RetryConfig.defaults(), RecoveryConfig.defaults(), 2);
    }

    public EngineConfig withPolling(PollingConfig polling) {
        return new EngineConfig(polling, retry, recovery, schedulerThreads);
    }

    public EngineConfig withRetry(RetryConfig retry) {
        return new EngineConfig(polling, retry, recovery, schedulerThreads);
    }

    public EngineConfig withRecovery(RecoveryConfig recovery) {
        return new EngineConfig(polling, retry, recovery, schedulerThreads);
    }

    /**
     * Loads {@value #RESOURCE} from the classpath (if present), letting system properties and
     * environment variables override individual keys. Missing keys keep their defaults.
     */
    public static EngineConfig load() {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = EngineConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
        return from(ConfigResolver.standard(properties));
    }

    /**
     * Builds a configuration from {@code pollguard.*} keys in the given properties only.
     */
    public static EngineConfig fromProperties(Properties properties) {
        return from(ConfigResolver.of(properties));
    }

    public static EngineConfig from(ConfigResolver resolver) {
        Objects.requireNonNull(resolver, "resolver must not be null");

        PollingConfig.Builder polling = PollingConfig.builder();
        resolver.resolveDuration(PREFIX + "polling.minInterval").ifPresent(polling::minInterval);
        resolver.resolveDuration(PREFIX + "polling.maxInterval").ifPresent(polling::maxInterval);
        resolver.resolveInt(PREFIX + "polling.inactivityThreshold").ifPresent(polling::inactivityThreshold);
        resolver.resolveDouble(PREFIX + "polling.growthFactor").ifPresent(polling::growthFactor);
        if (resolver.isDisabled(PREFIX + "polling.sessionTimeout")) {
            polling.sessionTimeout(null);
        } else {
            resolver.resolveDuration(PREFIX + "polling.sessionTimeout").ifPresent(polling::sessionTimeout);
        }

        RetryConfig.Builder retry = RetryConfig.builder();
        resolver.resolveInt(PREFIX + "retry.maxRetries").ifPresent(retry::maxRetries);
        resolver.resolveDuration(PREFIX + "retry.initialDelay").ifPresent(retry::initialDelay);
        resolver.resolveDuration(PREFIX + "retry.maxDelay").ifPresent(retry::maxDelay);
        resolver.resolveDouble(PREFIX + "retry.backoffMultiplier").ifPresent(retry::backoffMultiplier);
        resolver.resolveDouble(PREFIX + "retry.jitterFactor").ifPresent(retry::jitterFactor);
        if (resolver.isDisabled(PREFIX + "retry.fetchTimeout")) {
            retry.fetchTimeout(null);
        } else {
            resolver.resolveDuration(PREFIX + "retry.fetchTimeout").ifPresent(retry::fetchTimeout);
        }
        resolver.resolveInt(PREFIX + "retry.failureThreshold").ifPresent(retry::failureThreshold);
        resolver.resolveDuration(PREFIX + "retry.resetTimeout").ifPresent(retry::resetTimeout);
        resolver.resolveBoolean(PREFIX + "retry.circuitBreakerEnabled").ifPresent(retry::circuitBreakerEnabled);
        resolver.resolveBoolean(PREFIX + "retry.retryDomainFailures").ifPresent(retry::retryDomainFailures);
        resolver.resolveBoolean(PREFIX + "retry.retryUnknownFailures").ifPresent(retry::retryUnknownFailures);

        RecoveryConfig.Builder recovery = RecoveryConfig.builder();
        resolver.resolveEnum(PREFIX + "recovery.strategy", RecoveryStrategy.class).ifPresent(recovery::strategy);
        for (ErrorKind kind : ErrorKind.values()) {
            resolver.resolveEnum(PREFIX + "recovery.strategy." + kind.name().toLowerCase(Locale.ROOT), RecoveryStrategy.class)
                    .ifPresent(strategy -> recovery.strategyFor(kind, strategy));
        }
        resolver.resolveInt(PREFIX + "recovery.bufferCapacity").ifPresent(recovery::bufferCapacity);
        resolver.resolveInt(PREFIX + "recovery.maxReestablishments").ifPresent(recovery::maxReestablishments);
        resolver.resolveDuration(PREFIX + "recovery.initialDelay").ifPresent(recovery::initialDelay);
        resolver.resolveDuration(PREFIX + "recovery.maxDelay").ifPresent(recovery::maxDelay);
        resolver.resolveDouble(PREFIX + "recovery.backoffMultiplier").ifPresent(recovery::backoffMultiplier);
        resolver.resolveInt(PREFIX + "recovery.unhealthyThreshold").ifPresent(recovery::unhealthyThreshold);
        resolver.resolveInt(PREFIX + "recovery.failureThreshold").ifPresent(recovery::recoveryFailureThreshold);
        resolver.resolveDuration(PREFIX + "recovery.cooldown").ifPresent(recovery::recoveryCooldown);

        int threads = resolver.resolveInt(PREFIX + "schedulerThreads").orElse(2);

        return new EngineConfig(polling.build(), retry.build(), recovery.build(), threads);
    }
}
