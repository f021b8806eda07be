package com.phillippitts.signbridge.domain;

import java.util.List;

/**
 * Recognized sign sequence produced by gesture recognition on the Deaf side.
 *
 * @param intent recognized intent label (e.g. {@code CHEST_PAIN}), may be null
 * @param signs  recognized gloss tokens in signing order
 * @param phrase natural-language phrase attached by the recognizer, may be null
 */
public record SignInput(String intent, List<String> signs, String phrase) implements InputEvent {

    public SignInput {
        signs = signs == null ? List.of() : List.copyOf(signs);
    }

    public static SignInput ofPhrase(String intent, String phrase) {
        return new SignInput(intent, List.of(), phrase);
    }

    public static SignInput ofSigns(List<String> signs) {
        return new SignInput(null, signs, null);
    }

    /**
     * The recognizer's phrase when present, otherwise the glosses joined by spaces.
     */
    @Override
    public String derivedPhrase() {
        if (phrase != null && !phrase.isBlank()) {
            return phrase;
        }
        return String.join(" ", signs);
    }

    @Override
    public String modality() {
        return "sign";
    }
}
