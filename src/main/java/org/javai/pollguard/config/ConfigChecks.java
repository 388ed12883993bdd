package org.javai.pollguard.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Argument checks shared by the configuration records.
 */
final class ConfigChecks {

    private ConfigChecks() {
    }

    static Duration positive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, was: " + value);
        }
        return value;
    }

    static Duration positiveOrNull(Duration value, String name) {
        return value == null ? null : positive(value, name);
    }

    static int atLeast(int value, int min, String name) {
        if (value < min) {
            throw new IllegalArgumentException(name + " must be >= " + min + ", was: " + value);
        }
        return value;
    }

    static double atLeast(double value, double min, String name) {
        if (Double.isNaN(value) || value < min) {
            throw new IllegalArgumentException(name + " must be >= " + min + ", was: " + value);
        }
        return value;
    }

    static void notShorter(Duration longer, Duration shorter, String longerName, String shorterName) {
        if (longer.compareTo(shorter) < 0) {
            throw new IllegalArgumentException(
                    longerName + " must be >= " + shorterName + " (" + shorterName + ": " + shorter
                            + ", " + longerName + ": " + longer + ")");
        }
    }
}
