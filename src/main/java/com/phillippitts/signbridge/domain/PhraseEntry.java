package com.phillippitts.signbridge.domain;

import java.util.Objects;

/**
 * Pre-mediated phrase served by the emergency fast path.
 *
 * @param phrase       normalized lookup key
 * @param originalText phrase as it was registered
 * @param mediatedText text delivered on a hit
 * @param signIntent   optional gloss/intent label for the avatar, may be null
 * @param confidence   confidence in {@code mediatedText} (seed terms 1.0)
 */
public record PhraseEntry(
        String phrase,
        String originalText,
        String mediatedText,
        String signIntent,
        double confidence
) {

    public PhraseEntry {
        Objects.requireNonNull(phrase, "phrase must not be null");
        Objects.requireNonNull(mediatedText, "mediatedText must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
