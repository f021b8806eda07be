package com.phillippitts.signbridge.service.speech;

/**
 * Speech synthesis collaborator. Engine internals live outside this service; the
 * pipeline only needs start/end/error notifications and the ability to cut off the
 * current utterance.
 */
public interface SpeechOutput {

    /**
     * Starts speaking. Must not block until audio completes.
     */
    void speak(SpeechRequest request);

    /**
     * Stops the current utterance, if any. Its {@code onEnd} is not invoked. Safe to
     * call when nothing is playing.
     */
    void cancel();
}
