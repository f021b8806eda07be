package com.phillippitts.signbridge.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Timing and behavior of the mediation pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Timeout applied to each mediation call. */
    @Positive(message = "Mediation timeout must be positive")
    private long mediationTimeoutMs = 1500;

    /** Upper bound from input to terminal status when mediation fails. */
    @Positive(message = "Fallback ceiling must be positive")
    private long fallbackCeilingMs = 2000;

    /** Fast-path latency budget; overruns are logged and counted. */
    @Positive(message = "Emergency budget must be positive")
    private long emergencyBudgetMs = 150;

    /** Add successful mediation results to the medical phrase table. */
    private boolean learnFromMediation = false;

    /** Delivered utterances passed to mediation as conversation history. */
    @Min(value = 0, message = "History size must be >= 0")
    @Max(value = 50, message = "History size must be <= 50")
    private int historySize = 5;

    @AssertTrue(message = "pipeline.fallback-ceiling-ms must be >= pipeline.mediation-timeout-ms")
    public boolean isFallbackCeilingConsistent() {
        return fallbackCeilingMs >= mediationTimeoutMs;
    }

    /**
     * Timeout actually applied to mediation: the configured timeout, never above the ceiling.
     */
    public long effectiveMediationTimeoutMs() {
        return Math.min(mediationTimeoutMs, fallbackCeilingMs);
    }

    public long getMediationTimeoutMs() {
        return mediationTimeoutMs;
    }

    public void setMediationTimeoutMs(long mediationTimeoutMs) {
        this.mediationTimeoutMs = mediationTimeoutMs;
    }

    public long getFallbackCeilingMs() {
        return fallbackCeilingMs;
    }

    public void setFallbackCeilingMs(long fallbackCeilingMs) {
        this.fallbackCeilingMs = fallbackCeilingMs;
    }

    public long getEmergencyBudgetMs() {
        return emergencyBudgetMs;
    }

    public void setEmergencyBudgetMs(long emergencyBudgetMs) {
        this.emergencyBudgetMs = emergencyBudgetMs;
    }

    public boolean isLearnFromMediation() {
        return learnFromMediation;
    }

    public void setLearnFromMediation(boolean learnFromMediation) {
        this.learnFromMediation = learnFromMediation;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }
}
