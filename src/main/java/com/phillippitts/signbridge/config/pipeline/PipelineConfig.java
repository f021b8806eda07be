package com.phillippitts.signbridge.config.pipeline;

import com.phillippitts.signbridge.config.properties.CacheProperties;
import com.phillippitts.signbridge.config.properties.IdleStateProperties;
import com.phillippitts.signbridge.config.properties.PhraseProperties;
import com.phillippitts.signbridge.config.properties.PipelineProperties;
import com.phillippitts.signbridge.service.cache.AvatarContentCache;
import com.phillippitts.signbridge.service.cache.ContentCacheMeterBinder;
import com.phillippitts.signbridge.service.cache.store.FileKeyValueStore;
import com.phillippitts.signbridge.service.cache.store.InMemoryKeyValueStore;
import com.phillippitts.signbridge.service.cache.store.KeyValueStore;
import com.phillippitts.signbridge.service.idle.IdleStateManager;
import com.phillippitts.signbridge.service.mediation.MediationService;
import com.phillippitts.signbridge.service.mediation.RuleBasedMediationService;
import com.phillippitts.signbridge.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.signbridge.service.phrase.NormalizedPhraseCache;
import com.phillippitts.signbridge.service.phrase.PhraseTableLoader;
import com.phillippitts.signbridge.service.pipeline.MediationPipelineController;
import com.phillippitts.signbridge.service.pipeline.MediationPipelineControllerBuilder;
import com.phillippitts.signbridge.service.speech.LoggingSpeechOutput;
import com.phillippitts.signbridge.service.speech.SpeechOutput;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Composition root of the mediation pipeline. Every pipeline component is constructed here
 * once and handed to its consumers; none of them look each other up.
 */
@Configuration
public class PipelineConfig {

    public static final String EMERGENCY_PHRASES = "emergencyPhraseCache";
    public static final String MEDICAL_PHRASES = "medicalPhraseCache";

    private final PipelineProperties pipelineProperties;
    private final CacheProperties cacheProperties;

    public PipelineConfig(PipelineProperties pipelineProperties, CacheProperties cacheProperties) {
        this.pipelineProperties = pipelineProperties;
        this.cacheProperties = cacheProperties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PhraseTableLoader phraseTableLoader(ResourceLoader resourceLoader) {
        return new PhraseTableLoader(resourceLoader);
    }

    /**
     * Emergency phrases. Immutable once loaded.
     */
    @Bean(name = EMERGENCY_PHRASES)
    public NormalizedPhraseCache emergencyPhraseCache(PhraseTableLoader loader, PhraseProperties phrases) {
        return NormalizedPhraseCache.immutable("emergency", loader.load(phrases.getEmergencyLocation()));
    }

    /**
     * Medical terms. Seeded from the table, growable at runtime.
     */
    @Bean(name = MEDICAL_PHRASES)
    public NormalizedPhraseCache medicalPhraseCache(PhraseTableLoader loader, PhraseProperties phrases) {
        return NormalizedPhraseCache.growable("medical", loader.load(phrases.getMedicalLocation()));
    }

    /**
     * File-backed store. Active when cache.store=FILE.
     */
    @Bean
    @ConditionalOnProperty(prefix = "cache", name = "store", havingValue = "FILE")
    public KeyValueStore fileKeyValueStore() {
        return new FileKeyValueStore(Path.of(cacheProperties.getStoreDirectory()));
    }

    /**
     * In-memory store. Active when cache.store is MEMORY or missing.
     */
    @Bean
    @ConditionalOnProperty(prefix = "cache", name = "store", havingValue = "MEMORY", matchIfMissing = true)
    public KeyValueStore inMemoryKeyValueStore() {
        return new InMemoryKeyValueStore();
    }

    @Bean
    public AvatarContentCache avatarContentCache(KeyValueStore store, Clock clock) {
        return new AvatarContentCache(store, clock, cacheProperties.getSignCapacity(),
                cacheProperties.getAnimationCapacity(), cacheProperties.getTtl());
    }

    @Bean
    public ContentCacheMeterBinder contentCacheMeterBinder(AvatarContentCache cache) {
        return new ContentCacheMeterBinder(cache);
    }

    @Bean(destroyMethod = "close")
    public IdleStateManager idleStateManager(@Qualifier("idleScheduler") ScheduledExecutorService scheduler,
                                             IdleStateProperties idle) {
        return new IdleStateManager(scheduler, idle.getIdleTimeoutMs(), idle.getTransitionDurationMs());
    }

    /**
     * Local rule-based mediation unless another {@link MediationService} bean is defined.
     */
    @Bean
    @ConditionalOnMissingBean
    public MediationService mediationService() {
        return new RuleBasedMediationService();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpeechOutput speechOutput() {
        return new LoggingSpeechOutput();
    }

    @Bean
    public MediationPipelineController mediationPipelineController(
            @Qualifier(EMERGENCY_PHRASES) NormalizedPhraseCache emergencyPhrases,
            @Qualifier(MEDICAL_PHRASES) NormalizedPhraseCache medicalPhrases,
            AvatarContentCache contentCache,
            IdleStateManager idleStateManager,
            MediationService mediationService,
            SpeechOutput speechOutput,
            @Qualifier("pipelineExecutor") Executor pipelineExecutor,
            ApplicationEventPublisher publisher,
            PipelineMetricsPublisher metricsPublisher,
            Clock clock) {
        return MediationPipelineControllerBuilder.builder()
                .emergencyPhrases(emergencyPhrases)
                .medicalPhrases(medicalPhrases)
                .contentCache(contentCache)
                .idleStateManager(idleStateManager)
                .mediationService(mediationService)
                .speechOutput(speechOutput)
                .properties(pipelineProperties)
                .pipelineExecutor(pipelineExecutor)
                .publisher(publisher)
                .metricsPublisher(metricsPublisher)
                .clock(clock)
                .build();
    }
}
