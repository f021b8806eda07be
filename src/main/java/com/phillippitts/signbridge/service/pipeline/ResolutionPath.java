package com.phillippitts.signbridge.service.pipeline;

/**
 * How a pipeline cycle was resolved.
 */
public enum ResolutionPath {
    /** Emergency/medical phrase table hit; mediation skipped. */
    FAST_PATH("fast"),
    /** Mediation succeeded. */
    MEDIATED("mediated"),
    /** Mediation failed or timed out; the raw input was delivered. */
    FALLBACK("fallback"),
    /** A newer input cancelled this cycle before it produced output. */
    SUPERSEDED("superseded"),
    /** Input carried no text. */
    IGNORED("ignored");

    private final String metricTag;

    ResolutionPath(String metricTag) {
        this.metricTag = metricTag;
    }

    public String metricTag() {
        return metricTag;
    }
}
