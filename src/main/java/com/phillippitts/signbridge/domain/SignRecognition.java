package com.phillippitts.signbridge.domain;

import java.util.List;

/**
 * Cached result of recognizing a hand-pose sample (gesture → signs).
 *
 * @param recognizedSigns gloss tokens recognized from the sample
 * @param confidence      recognizer confidence between 0.0 and 1.0
 */
public record SignRecognition(List<String> recognizedSigns, double confidence) {

    public SignRecognition {
        recognizedSigns = recognizedSigns == null ? List.of() : List.copyOf(recognizedSigns);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
