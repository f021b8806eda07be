package com.phillippitts.signbridge.service.pipeline;

import com.phillippitts.signbridge.config.properties.PipelineProperties;
import com.phillippitts.signbridge.service.cache.AvatarContentCache;
import com.phillippitts.signbridge.service.idle.IdleStateManager;
import com.phillippitts.signbridge.service.mediation.MediationService;
import com.phillippitts.signbridge.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.signbridge.service.phrase.NormalizedPhraseCache;
import com.phillippitts.signbridge.service.speech.SpeechOutput;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Builder for {@link MediationPipelineController}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MediationPipelineController controller = MediationPipelineControllerBuilder.builder()
 *     .emergencyPhrases(emergencyTable)
 *     .medicalPhrases(medicalTable)
 *     .contentCache(avatarContentCache)
 *     .idleStateManager(idleStateManager)
 *     .mediationService(mediationService)
 *     .speechOutput(speechOutput)
 *     .properties(pipelineProperties)
 *     .pipelineExecutor(executor)
 *     .publisher(eventPublisher)
 *     .build();
 * }</pre>
 *
 * <p>Optional: {@code pipelineExecutor} (common pool), {@code publisher} (discards events),
 * {@code metricsPublisher} ({@link PipelineMetricsPublisher#NOOP}), {@code clock} (system UTC).
 *
 * @since 1.0
 */
public final class MediationPipelineControllerBuilder {

    // Required dependencies
    private NormalizedPhraseCache emergencyPhrases;
    private NormalizedPhraseCache medicalPhrases;
    private AvatarContentCache contentCache;
    private IdleStateManager idleStateManager;
    private MediationService mediationService;
    private SpeechOutput speechOutput;
    private PipelineProperties properties;

    // Optional dependencies
    private Executor pipelineExecutor;
    private ApplicationEventPublisher publisher;
    private PipelineMetricsPublisher metricsPublisher;
    private Clock clock;

    private MediationPipelineControllerBuilder() {
    }

    public static MediationPipelineControllerBuilder builder() {
        return new MediationPipelineControllerBuilder();
    }

    /**
     * @param emergencyPhrases immutable emergency table, consulted first (required)
     */
    public MediationPipelineControllerBuilder emergencyPhrases(NormalizedPhraseCache emergencyPhrases) {
        this.emergencyPhrases = emergencyPhrases;
        return this;
    }

    /**
     * @param medicalPhrases growable medical table (required)
     */
    public MediationPipelineControllerBuilder medicalPhrases(NormalizedPhraseCache medicalPhrases) {
        this.medicalPhrases = medicalPhrases;
        return this;
    }

    public MediationPipelineControllerBuilder contentCache(AvatarContentCache contentCache) {
        this.contentCache = contentCache;
        return this;
    }

    public MediationPipelineControllerBuilder idleStateManager(IdleStateManager idleStateManager) {
        this.idleStateManager = idleStateManager;
        return this;
    }

    public MediationPipelineControllerBuilder mediationService(MediationService mediationService) {
        this.mediationService = mediationService;
        return this;
    }

    public MediationPipelineControllerBuilder speechOutput(SpeechOutput speechOutput) {
        this.speechOutput = speechOutput;
        return this;
    }

    public MediationPipelineControllerBuilder properties(PipelineProperties properties) {
        this.properties = properties;
        return this;
    }

    /**
     * @param pipelineExecutor executor for mediation completion handling
     */
    public MediationPipelineControllerBuilder pipelineExecutor(Executor pipelineExecutor) {
        this.pipelineExecutor = pipelineExecutor;
        return this;
    }

    public MediationPipelineControllerBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public MediationPipelineControllerBuilder metricsPublisher(PipelineMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    /**
     * @param clock time source for status timestamps and latency measurement
     */
    public MediationPipelineControllerBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public MediationPipelineController build() {
        Objects.requireNonNull(emergencyPhrases, "emergencyPhrases is required");
        Objects.requireNonNull(medicalPhrases, "medicalPhrases is required");
        Objects.requireNonNull(contentCache, "contentCache is required");
        Objects.requireNonNull(idleStateManager, "idleStateManager is required");
        Objects.requireNonNull(mediationService, "mediationService is required");
        Objects.requireNonNull(speechOutput, "speechOutput is required");
        Objects.requireNonNull(properties, "properties is required");

        return new MediationPipelineController(
                emergencyPhrases,
                medicalPhrases,
                contentCache,
                idleStateManager,
                mediationService,
                speechOutput,
                properties,
                pipelineExecutor != null ? pipelineExecutor : ForkJoinPool.commonPool(),
                publisher != null ? publisher : event -> { },
                metricsPublisher != null ? metricsPublisher : PipelineMetricsPublisher.NOOP,
                clock != null ? clock : Clock.systemUTC()
        );
    }
}
