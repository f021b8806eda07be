package com.phillippitts.signbridge.service.speech;

import com.phillippitts.signbridge.domain.PipelineContext;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * One utterance handed to {@link SpeechOutput}. Callbacks may be invoked on any thread.
 *
 * @param text    text to speak
 * @param context pipeline context of the cycle
 * @param voice   synthesis parameters
 * @param onStart invoked when audio starts
 * @param onEnd   invoked when audio finishes normally
 * @param onError invoked instead of {@code onEnd} when synthesis fails
 */
public record SpeechRequest(
        String text,
        PipelineContext context,
        VoiceProfile voice,
        Runnable onStart,
        Runnable onEnd,
        Consumer<Throwable> onError
) {

    public SpeechRequest {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(context, "context must not be null");
        voice = voice == null ? VoiceProfile.forScenario(context.scenario()) : voice;
        onStart = onStart == null ? () -> { } : onStart;
        onEnd = onEnd == null ? () -> { } : onEnd;
        onError = onError == null ? t -> { } : onError;
    }
}
