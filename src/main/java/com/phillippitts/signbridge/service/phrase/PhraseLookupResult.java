package com.phillippitts.signbridge.service.phrase;

import com.phillippitts.signbridge.domain.PhraseEntry;

import java.util.Optional;

/**
 * Outcome of a phrase lookup with its measured cost.
 *
 * @param hit              whether the normalized phrase was found
 * @param entry            the matching entry, null on a miss
 * @param lookupTimeMicros time spent normalizing and probing, in microseconds
 */
public record PhraseLookupResult(boolean hit, PhraseEntry entry, double lookupTimeMicros) {

    public static PhraseLookupResult hit(PhraseEntry entry, double lookupTimeMicros) {
        return new PhraseLookupResult(true, entry, lookupTimeMicros);
    }

    public static PhraseLookupResult miss(double lookupTimeMicros) {
        return new PhraseLookupResult(false, null, lookupTimeMicros);
    }

    public Optional<PhraseEntry> entryIfHit() {
        return Optional.ofNullable(entry);
    }
}
