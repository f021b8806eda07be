package com.phillippitts.signbridge.service.mediation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Cleans backend output before it is spoken or signed: single line, no markdown
 * emphasis, no emoji, at most {@value #MAX_WORDS} words.
 */
public final class MediatedTextSanitizer {

    private static final Logger LOG = LogManager.getLogger(MediatedTextSanitizer.class);

    static final int MAX_WORDS = 25;
    static final int TRUNCATED_WORDS = 20;
    static final String ELLIPSIS = "...";

    private static final Pattern EMPHASIS = Pattern.compile("\\*+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EMOJI = Pattern.compile(
            "[\\x{1F600}-\\x{1F64F}\\x{1F300}-\\x{1F5FF}\\x{1F680}-\\x{1F6FF}"
                    + "\\x{2600}-\\x{26FF}\\x{2700}-\\x{27BF}]");

    private MediatedTextSanitizer() {
    }

    /**
     * Returns the cleaned text, or "" when nothing usable remains.
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String text = EMPHASIS.matcher(raw).replaceAll("");
        String noEmoji = EMOJI.matcher(text).replaceAll("");
        if (noEmoji.length() != text.length()) {
            LOG.debug("Removed emoji from mediated text");
        }
        text = WHITESPACE.matcher(noEmoji).replaceAll(" ").trim();
        if (text.isEmpty()) {
            return text;
        }
        String[] words = text.split(" ");
        if (words.length > MAX_WORDS) {
            LOG.warn("Mediated text too long ({} words), truncating to {}", words.length, TRUNCATED_WORDS);
            return String.join(" ", Arrays.copyOf(words, TRUNCATED_WORDS)) + ELLIPSIS;
        }
        return text;
    }
}
