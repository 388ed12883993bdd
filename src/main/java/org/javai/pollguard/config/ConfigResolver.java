package org.javai.pollguard.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Resolves {@code pollguard.*} settings from, in order of precedence, system properties,
 * environment variables and a properties bundle.
 *
 * <p>The environment variable for a key is the key upper-cased with dots replaced by
 * underscores: {@code pollguard.retry.maxRetries} is read from {@code POLLGUARD_RETRY_MAXRETRIES}.
 */
public final class ConfigResolver {

    private final Properties properties;
    private final Function<String, String> systemProperties;
    private final Function<String, String> environment;

    public ConfigResolver(Properties properties,
                          Function<String, String> systemProperties,
                          Function<String, String> environment) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * A resolver backed by the JVM's system properties and the process environment.
     */
    public static ConfigResolver standard(Properties properties) {
        return new ConfigResolver(properties, System::getProperty, System::getenv);
    }

    /**
     * A resolver that only looks at the given properties.
     */
    public static ConfigResolver of(Properties properties) {
        return new ConfigResolver(properties, key -> null, key -> null);
    }

    static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    public Optional<String> resolve(String key) {
        String value = systemProperties.apply(key);
        if (value == null || value.isBlank()) {
            value = environment.apply(envName(key));
        }
        if (value == null || value.isBlank()) {
            value = properties.getProperty(key);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public Optional<Integer> resolveInt(String key) {
        return resolve(key).map(value -> {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw invalid(key, value, "an integer", e);
            }
        });
    }

    public Optional<Double> resolveDouble(String key) {
        return resolve(key).map(value -> {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw invalid(key, value, "a decimal number", e);
            }
        });
    }

    public Optional<Boolean> resolveBoolean(String key) {
        return resolve(key).map(value -> {
            if ("true".equalsIgnoreCase(value)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(value)) {
                return Boolean.FALSE;
            }
            throw invalid(key, value, "true or false", null);
        });
    }

    /**
     * Reads a duration written either in ISO-8601 ({@code PT1.5S}) or as plain milliseconds ({@code 1500}).
     */
    public Optional<Duration> resolveDuration(String key) {
        return resolve(key).map(value -> parseDuration(key, value));
    }

    /**
     * Whether the key is set to the literal {@code none}, which switches an optional setting off.
     */
    public boolean isDisabled(String key) {
        return resolve(key).map("none"::equalsIgnoreCase).orElse(false);
    }

    public <E extends Enum<E>> Optional<E> resolveEnum(String key, Class<E> type) {
        return resolve(key).map(value -> {
            try {
                return Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw invalid(key, value, "one of " + Arrays.toString(type.getEnumConstants()), e);
            }
        });
    }

    private static Duration parseDuration(String key, String value) {
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            return Duration.parse(value.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw invalid(key, value, "an ISO-8601 duration or milliseconds", e);
        }
    }

    private static IllegalArgumentException invalid(String key, String value, String expected, Exception cause) {
        return new IllegalArgumentException(
                "Invalid configuration '" + key + "': expected " + expected + " but was '" + value + "'", cause);
    }
}
