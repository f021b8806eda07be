package com.phillippitts.signbridge.domain;

/**
 * Transcript produced by speech recognition on the hearing side.
 *
 * @param transcript recognized speech (may be empty)
 */
public record SpeechInput(String transcript) implements InputEvent {

    public SpeechInput {
        transcript = transcript == null ? "" : transcript;
    }

    @Override
    public String derivedPhrase() {
        return transcript;
    }

    @Override
    public String modality() {
        return "speech";
    }
}
