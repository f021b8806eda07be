package com.phillippitts.signbridge.service.mediation;

import com.phillippitts.signbridge.domain.PipelineContext;

import java.util.List;
import java.util.Objects;

/**
 * Input to a mediation call.
 *
 * @param input         transcript or sign-derived phrase, as received
 * @param context       conversation direction and scenario
 * @param recentHistory previously delivered utterances, oldest first (may be empty)
 */
public record MediationRequest(String input, PipelineContext context, List<String> recentHistory) {

    public MediationRequest {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(context, "context must not be null");
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
    }
}
