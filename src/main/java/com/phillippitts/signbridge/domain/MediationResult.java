package com.phillippitts.signbridge.domain;

import java.util.Objects;

/**
 * Output of the external mediation operation.
 *
 * @param mediatedText text to deliver to the other party (never null)
 * @param confidence   backend confidence between 0.0 and 1.0
 */
public record MediationResult(String mediatedText, double confidence) {

    public MediationResult {
        Objects.requireNonNull(mediatedText, "mediatedText must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
