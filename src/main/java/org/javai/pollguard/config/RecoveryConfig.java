package org.javai.pollguard.config;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.javai.pollguard.ErrorKind;
import org.javai.pollguard.recovery.RecoveryStrategy;

import static org.javai.pollguard.config.ConfigChecks.*;

/**
 * Settings for the recovery wrapper around a value source.
 *
 * @param strategy Strategy applied when the source errors
 * @param bufferCapacity Maximum number of undelivered values kept by {@link RecoveryStrategy#BUFFER}
 * @param maxReestablishments Re-open attempts {@link RecoveryStrategy#RETRY} makes before escalating
 * @param initialDelay Delay before the first re-open attempt
 * @param maxDelay Cap for any re-open delay
 * @param backoffMultiplier Growth factor between re-open delays
 * @param unhealthyThreshold Consecutive errors after which health becomes {@code UNHEALTHY}
 * @param recoveryFailureThreshold Consecutive errors after which {@link RecoveryStrategy#CIRCUIT_BREAKING} cools down
 * @param recoveryCooldown Length of the cool-down window
 * @param strategyOverrides Strategies that replace {@code strategy} for particular error kinds
 */
public record RecoveryConfig(
        RecoveryStrategy strategy,
        int bufferCapacity,
        int maxReestablishments,
        Duration initialDelay,
        Duration maxDelay,
        double backoffMultiplier,
        int unhealthyThreshold,
        int recoveryFailureThreshold,
        Duration recoveryCooldown,
        Map<ErrorKind, RecoveryStrategy> strategyOverrides
) {

    public RecoveryConfig {
        Objects.requireNonNull(strategy, "strategy must not be null");
        atLeast(bufferCapacity, 1, "bufferCapacity");
        atLeast(maxReestablishments, 0, "maxReestablishments");
        positive(initialDelay, "initialDelay");
        positive(maxDelay, "maxDelay");
        notShorter(maxDelay, initialDelay, "maxDelay", "initialDelay");
        atLeast(backoffMultiplier, 1.0, "backoffMultiplier");
        atLeast(unhealthyThreshold, 1, "unhealthyThreshold");
        atLeast(recoveryFailureThreshold, 1, "recoveryFailureThreshold");
        positive(recoveryCooldown, "recoveryCooldown");
        strategyOverrides = copyOverrides(strategyOverrides);
    }

    public static RecoveryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .strategy(strategy)
                .bufferCapacity(bufferCapacity)
                .maxReestablishments(maxReestablishments)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .unhealthyThreshold(unhealthyThreshold)
                .recoveryFailureThreshold(recoveryFailureThreshold)
                .recoveryCooldown(recoveryCooldown)
                .strategyOverrides(strategyOverrides);
    }

    /**
     * The strategy applied to a source error of the given kind.
     */
    public RecoveryStrategy strategyFor(ErrorKind kind) {
        return strategyOverrides.getOrDefault(kind, strategy);
    }

    /**
     * Whether the strategy is configured, either as the default or for some error kind.
     */
    public boolean usesStrategy(RecoveryStrategy candidate) {
        return strategy == candidate || strategyOverrides.containsValue(candidate);
    }

    private static Map<ErrorKind, RecoveryStrategy> copyOverrides(Map<ErrorKind, RecoveryStrategy> overrides) {
        Objects.requireNonNull(overrides, "strategyOverrides must not be null");
        EnumMap<ErrorKind, RecoveryStrategy> copy = new EnumMap<>(ErrorKind.class);
        overrides.forEach((kind, override) -> {
            Objects.requireNonNull(kind, "strategyOverrides must not contain a null error kind");
            if (override == null) {
                throw new IllegalArgumentException("strategyOverrides has no strategy for " + kind);
            }
            copy.put(kind, override);
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Re-open delay for the given attempt (1-based): {@code min(maxDelay, initialDelay * multiplier^(attempt-1))}.
     */
    public Duration reestablishDelay(int attempt) {
        if (attempt <= 1) {
            return initialDelay;
        }
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.round(millis));
    }

    public static final class Builder {
        private RecoveryStrategy strategy = RecoveryStrategy.RETRY;
        private int bufferCapacity = 100;
        private int maxReestablishments = 3;
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private int unhealthyThreshold = 3;
        private int recoveryFailureThreshold = 5;
        private Duration recoveryCooldown = Duration.ofMinutes(1);
        private final Map<ErrorKind, RecoveryStrategy> strategyOverrides = new EnumMap<>(ErrorKind.class);

        private Builder() {
        }

        public Builder strategy(RecoveryStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        public Builder maxReestablishments(int maxReestablishments) {
            this.maxReestablishments = maxReestablishments;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder unhealthyThreshold(int unhealthyThreshold) {
            this.unhealthyThreshold = unhealthyThreshold;
            return this;
        }

        public Builder recoveryFailureThreshold(int recoveryFailureThreshold) {
            this.recoveryFailureThreshold = recoveryFailureThreshold;
            return this;
        }

        public Builder recoveryCooldown(Duration recoveryCooldown) {
            this.recoveryCooldown = recoveryCooldown;
            return this;
        }

        /**
         * Applies {@code strategy} instead of the default one to source errors of the given kind.
         */
        public Builder strategyFor(ErrorKind kind, RecoveryStrategy strategy) {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(strategy, "strategy must not be null");
            strategyOverrides.put(kind, strategy);
            return this;
        }

        /**
         * Replaces every per-kind override.
         */
        public Builder strategyOverrides(Map<ErrorKind, RecoveryStrategy> overrides) {
            strategyOverrides.clear();
            strategyOverrides.putAll(copyOverrides(overrides));
            return this;
        }

        public RecoveryConfig build() {
            return new RecoveryConfig(strategy, bufferCapacity, maxReestablishments, initialDelay, maxDelay,
                    backoffMultiplier, unhealthyThreshold, recoveryFailureThreshold, recoveryCooldown,
                    strategyOverrides);
        }
    }
}
