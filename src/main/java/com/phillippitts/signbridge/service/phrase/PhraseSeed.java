package com.phillippitts.signbridge.service.phrase;

/**
 * Un-normalized phrase definition as read from a phrase table resource.
 *
 * @param phrase       phrase as authored (normalized on insert)
 * @param mediatedText pre-mediated output
 * @param signIntent   optional intent/gloss label, may be null
 */
public record PhraseSeed(String phrase, String mediatedText, String signIntent) {
}
