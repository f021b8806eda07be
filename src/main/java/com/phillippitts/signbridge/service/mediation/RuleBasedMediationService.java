package com.phillippitts.signbridge.service.mediation;

import com.phillippitts.signbridge.domain.MediationMode;
import com.phillippitts.signbridge.domain.MediationResult;
import com.phillippitts.signbridge.exception.MediationException;
import com.phillippitts.signbridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Local mediation backend used when no generative backend is configured.
 *
 * <p>Passes the input through with light clean-up: sanitized, first letter capitalized
 * and terminated as a sentence. Sign glosses arriving in {@code deaf-to-hearing} mode
 * are lower-cased first so {@code "PAIN CHEST"} reads as {@code "Pain chest."}.
 * Completes synchronously.
 */
public class RuleBasedMediationService implements MediationService {

    private static final Logger LOG = LogManager.getLogger(RuleBasedMediationService.class);

    public static final String NAME = "rule-based";

    static final double CONFIDENCE = 0.6;

    @Override
    public CompletableFuture<MediationResult> mediate(MediationRequest request) {
        String text = MediatedTextSanitizer.sanitize(request.input());
        if (text.isEmpty()) {
            return CompletableFuture.failedFuture(new MediationException("Empty input", NAME));
        }
        if (request.context().mode() == MediationMode.DEAF_TO_HEARING && isAllUpperCase(text)) {
            text = text.toLowerCase(Locale.ROOT);
        }
        String mediated = asSentence(text);
        LOG.debug("Rule-based mediation ({}): {}", request.context().mode().label(), LogSanitizer.preview(mediated));
        return CompletableFuture.completedFuture(new MediationResult(mediated, CONFIDENCE));
    }

    @Override
    public String getName() {
        return NAME;
    }

    static String asSentence(String text) {
        String s = Character.toUpperCase(text.charAt(0)) + text.substring(1);
        char last = s.charAt(s.length() - 1);
        if (last == '.' || last == '?' || last == '!') {
            return s;
        }
        return s + ".";
    }

    private static boolean isAllUpperCase(String text) {
        boolean sawLetter = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                sawLetter = true;
                if (!Character.isUpperCase(c)) {
                    return false;
                }
            }
        }
        return sawLetter;
    }
}
