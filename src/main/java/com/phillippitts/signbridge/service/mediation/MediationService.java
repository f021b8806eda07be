package com.phillippitts.signbridge.service.mediation;

import com.phillippitts.signbridge.domain.MediationResult;
import com.phillippitts.signbridge.exception.MediationException;

import java.util.concurrent.CompletableFuture;

/**
 * Contract for the mediation backend that turns raw input into text suitable for the
 * other party.
 *
 * <p>Implementations are asynchronous and may be slow. The pipeline applies its own
 * timeout and treats any exceptional completion as a mediation failure, so backends
 * do not need their own fallback. Completing exceptionally with a
 * {@link MediationException} lets the failure be attributed to a backend in logs.
 *
 * <p>Thread Safety: implementations must accept concurrent calls.
 */
public interface MediationService {

    /**
     * Mediates one input.
     *
     * @param request raw input plus context
     * @return future completing with the mediated text, or exceptionally on failure
     */
    CompletableFuture<MediationResult> mediate(MediationRequest request);

    /**
     * Backend name for logs and metrics (e.g. "rule-based").
     */
    String getName();
}
