package com.phillippitts.signbridge.service.speech;

import com.phillippitts.signbridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default speech output for headless deployments: records the utterance and reports it
 * as spoken immediately. Clients that own an audio device synthesize from the subtitle
 * channel instead.
 */
public class LoggingSpeechOutput implements SpeechOutput {

    private static final Logger LOG = LogManager.getLogger(LoggingSpeechOutput.class);

    @Override
    public void speak(SpeechRequest request) {
        LOG.info("Speaking ({}, rate={}, scenario={})", LogSanitizer.describe(request.text()),
                request.voice().rate(), request.context().scenario().key());
        try {
            request.onStart().run();
            request.onEnd().run();
        } catch (RuntimeException e) {
            LOG.warn("Speech callback failed: {}", e.toString());
            request.onError().accept(e);
        }
    }

    @Override
    public void cancel() {
        LOG.debug("Speech cancel requested");
    }
}
