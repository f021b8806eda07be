package com.phillippitts.signbridge.domain;

import java.util.Locale;

/**
 * Setting in which the conversation takes place. Drives voice parameters and
 * the tone requested from mediation.
 */
public enum Scenario {
    HOSPITAL,
    EMERGENCY,
    DEFAULT;

    /**
     * Lower-case identifier used in cache keys and logs.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup; null or blank means {@link #DEFAULT}.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static Scenario parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scenario: " + value, e);
        }
    }
}
