package com.phillippitts.signbridge.domain;

/**
 * A single user input handed to the mediation pipeline.
 *
 * @see SpeechInput
 * @see SignInput
 */
public interface InputEvent {

    /**
     * Text used for phrase lookup and mediation. May be blank, in which case the
     * pipeline ignores the event.
     */
    String derivedPhrase();

    /**
     * Short modality name for logs and metrics ("speech", "sign").
     */
    String modality();
}
