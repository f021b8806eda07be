package com.phillippitts.signbridge.service.phrase;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes phrases so that inputs differing only in case, punctuation or spacing
 * share one lookup key.
 *
 * <p>Rules, in order: lower-case (root locale), drop every character that is not a letter,
 * digit or whitespace, collapse whitespace runs to a single space, trim.
 *
 * <pre>
 * "  CHEST   PAIN  " → "chest pain"
 * "chest, pain?"     → "chest pain"
 * "Can't breathe"    → "cant breathe"
 * </pre>
 */
public final class PhraseNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PhraseNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Normalizes a raw phrase; null becomes the empty string.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }
}
