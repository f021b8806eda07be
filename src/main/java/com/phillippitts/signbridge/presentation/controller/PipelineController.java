package com.phillippitts.signbridge.presentation.controller;

import com.phillippitts.signbridge.config.pipeline.PipelineConfig;
import com.phillippitts.signbridge.domain.AvatarAnimation;
import com.phillippitts.signbridge.domain.InputEvent;
import com.phillippitts.signbridge.domain.MediationMode;
import com.phillippitts.signbridge.domain.PipelineContext;
import com.phillippitts.signbridge.domain.Scenario;
import com.phillippitts.signbridge.domain.SignInput;
import com.phillippitts.signbridge.domain.SpeechInput;
import com.phillippitts.signbridge.service.cache.AvatarContentCache;
import com.phillippitts.signbridge.service.idle.IdleStateManager;
import com.phillippitts.signbridge.service.phrase.NormalizedPhraseCache;
import com.phillippitts.signbridge.service.pipeline.MediationPipelineController;
import com.phillippitts.signbridge.service.pipeline.PipelineOutcome;
import com.phillippitts.signbridge.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Thin HTTP surface over the mediation pipeline and its caches. Used for manual
 * driving and operational inspection; the pipeline itself has no HTTP dependency.
 */
@RestController
@RequestMapping("/api")
class PipelineController {

    private static final Logger LOG = LogManager.getLogger(PipelineController.class);

    static final int MOST_USED_TERMS = 10;

    private final MediationPipelineController pipeline;
    private final AvatarContentCache contentCache;
    private final IdleStateManager idleStateManager;
    private final NormalizedPhraseCache emergencyPhrases;
    private final NormalizedPhraseCache medicalPhrases;

    PipelineController(MediationPipelineController pipeline,
                       AvatarContentCache contentCache,
                       IdleStateManager idleStateManager,
                       @Qualifier(PipelineConfig.EMERGENCY_PHRASES) NormalizedPhraseCache emergencyPhrases,
                       @Qualifier(PipelineConfig.MEDICAL_PHRASES) NormalizedPhraseCache medicalPhrases) {
        this.pipeline = pipeline;
        this.contentCache = contentCache;
        this.idleStateManager = idleStateManager;
        this.emergencyPhrases = emergencyPhrases;
        this.medicalPhrases = medicalPhrases;
    }

    /**
     * Runs one pipeline cycle. Completes when the cycle reaches SPEAKING, is ignored,
     * or is superseded by a later request.
     */
    @PostMapping("/pipeline/input")
    CompletableFuture<PipelineOutcome> processInput(@RequestBody InputRequest request) {
        PipelineContext context = request.toContext();
        InputEvent input = request.toInputEvent(context.mode());
        LOG.info("Pipeline input via REST: mode={}, scenario={}, modality={}, text={}",
                context.mode().label(), context.scenario().key(), input.modality(),
                LogSanitizer.preview(input.derivedPhrase()));
        return pipeline.processInput(input, context, request.emergencyModeEnabled());
    }

    @GetMapping("/pipeline/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", pipeline.getCurrentStatus().name());
        body.put("cycleId", pipeline.getCurrentCycleId().map(Object::toString).orElse(null));
        body.put("processing", pipeline.isProcessing());
        body.put("recentHistory", pipeline.getRecentHistory());
        return ResponseEntity.ok(body);
    }

    /**
     * Abandons the cycle in flight, e.g. when the operator switches mode or scenario.
     */
    @PostMapping("/pipeline/cancel")
    ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = pipeline.cancel();
        LOG.info("Pipeline cancel via REST: cancelled={}", cancelled);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping("/cache/metrics")
    ResponseEntity<Map<String, Object>> cacheMetrics() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("metrics", contentCache.getMetrics());
        body.put("mostUsed", contentCache.getMostUsed());
        body.put("persistenceDegraded", contentCache.isPersistenceDegraded());
        return ResponseEntity.ok(body);
    }

    /**
     * Stores an avatar rendering so later hearing-to-deaf cycles for the same text and
     * scenario get it attached.
     */
    @PutMapping("/cache/animation")
    ResponseEntity<Map<String, Object>> putAnimation(@Valid @RequestBody AnimationRequest request) {
        String key = contentCache.generateTextKey(request.text(), Scenario.parse(request.scenario()));
        contentCache.setAvatarAnimation(key, request.toAnimation());
        return ResponseEntity.ok(Map.of("key", key));
    }

    @DeleteMapping("/cache")
    ResponseEntity<Void> clearCache() {
        contentCache.clearAll();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/phrases/medical")
    ResponseEntity<Map<String, Object>> addMedicalTerm(@Valid @RequestBody TermRequest request) {
        if (request.signIntent() == null) {
            medicalPhrases.addTerm(request.phrase(), request.mediatedText());
        } else {
            medicalPhrases.addTerm(request.phrase(), request.mediatedText(), request.signIntent(),
                    NormalizedPhraseCache.DEFAULT_LEARNED_CONFIDENCE);
        }
        LOG.info("Medical term added via REST: {}", LogSanitizer.preview(request.phrase()));
        return ResponseEntity.ok(Map.of("size", medicalPhrases.size()));
    }

    @GetMapping("/phrases/stats")
    ResponseEntity<Map<String, Object>> phraseStats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(emergencyPhrases.getName(), describe(emergencyPhrases));
        body.put(medicalPhrases.getName(), describe(medicalPhrases));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/avatar/idle")
    ResponseEntity<Map<String, Object>> idleState() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", idleStateManager.getState().name());
        body.put("timeSinceLastActivityMs", idleStateManager.getTimeSinceLastActivity());
        body.put("idleTimeoutMs", idleStateManager.getIdleTimeoutMs());
        body.put("transitionDurationMs", idleStateManager.getTransitionDurationMs());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> describe(NormalizedPhraseCache table) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("size", table.size());
        m.put("mutable", table.isMutable());
        m.put("stats", table.getStats());
        m.put("mostUsed", table.getMostUsedTerms(MOST_USED_TERMS));
        return m;
    }

    /**
     * Pipeline input. Signs, an intent, or deaf-to-hearing mode produce a sign input;
     * anything else is treated as a speech transcript.
     */
    record InputRequest(String text, List<String> signs, String intent, String mode, String scenario,
                        Boolean emergencyMode) {

        PipelineContext toContext() {
            return PipelineContext.of(MediationMode.parse(mode), Scenario.parse(scenario));
        }

        InputEvent toInputEvent(MediationMode resolvedMode) {
            boolean hasSigns = signs != null && !signs.isEmpty();
            if (hasSigns || intent != null || resolvedMode == MediationMode.DEAF_TO_HEARING) {
                return new SignInput(intent, signs, text);
            }
            return new SpeechInput(text);
        }

        boolean emergencyModeEnabled() {
            return emergencyMode == null || emergencyMode;
        }
    }

    record TermRequest(@NotBlank String phrase, @NotBlank String mediatedText, String signIntent) {
    }

    record AnimationRequest(@NotBlank String text, String scenario, List<String> signSequence,
                            String videoPath, String animationPayload) {

        AvatarAnimation toAnimation() {
            return new AvatarAnimation(signSequence, videoPath, animationPayload);
        }
    }
}
