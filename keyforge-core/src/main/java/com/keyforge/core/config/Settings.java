package com.keyforge.core.config;

import com.keyforge.core.error.ConfigurationException;

import java.time.Duration;

final class Settings {

    private Settings() {
    }

    static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new ConfigurationException(name + " must be a positive duration, was " + duration);
        }
    }

    static void requireNonNegative(Duration duration, String name) {
        if (duration == null || duration.isNegative()) {
            throw new ConfigurationException(name + " cannot be negative or missing, was " + duration);
        }
    }

    static void requireRatio(double ratio, String name, boolean allowZero) {
        boolean lowOk = allowZero ? ratio >= 0.0 : ratio > 0.0;
        if (!lowOk || ratio > 1.0 || Double.isNaN(ratio)) {
            throw new ConfigurationException(name + " must be within " + (allowZero ? "[0, 1]" : "(0, 1]")
                    + ", was " + ratio);
        }
    }
}
