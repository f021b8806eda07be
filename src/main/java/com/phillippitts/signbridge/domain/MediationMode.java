package com.phillippitts.signbridge.domain;

/**
 * Direction of a conversation turn.
 */
public enum MediationMode {

    /** A Deaf user signs; the hearing user receives speech. */
    DEAF_TO_HEARING("deaf-to-hearing"),

    /** A hearing user speaks; the Deaf user receives avatar signing. */
    HEARING_TO_DEAF("hearing-to-deaf");

    private final String label;

    MediationMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts either the label ({@code deaf-to-hearing}) or the constant name.
     *
     * @throws IllegalArgumentException for blank or unknown values
     */
    public static MediationMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("mode must not be blank");
        }
        String v = value.trim();
        for (MediationMode mode : values()) {
            if (mode.label.equalsIgnoreCase(v) || mode.name().equalsIgnoreCase(v)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode: " + value);
    }
}
