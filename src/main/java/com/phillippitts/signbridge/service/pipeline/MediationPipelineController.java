package com.phillippitts.signbridge.service.pipeline;

import com.phillippitts.signbridge.config.properties.PipelineProperties;
import com.phillippitts.signbridge.domain.AvatarAnimation;
import com.phillippitts.signbridge.domain.InputEvent;
import com.phillippitts.signbridge.domain.MediationMode;
import com.phillippitts.signbridge.domain.MediationResult;
import com.phillippitts.signbridge.domain.PhraseEntry;
import com.phillippitts.signbridge.domain.PipelineContext;
import com.phillippitts.signbridge.domain.PipelineStatus;
import com.phillippitts.signbridge.exception.MediationException;
import com.phillippitts.signbridge.exception.MediationTimeoutException;
import com.phillippitts.signbridge.service.cache.AvatarContentCache;
import com.phillippitts.signbridge.service.cache.CacheEntry;
import com.phillippitts.signbridge.service.idle.IdleStateManager;
import com.phillippitts.signbridge.service.mediation.MediatedTextSanitizer;
import com.phillippitts.signbridge.service.mediation.MediationRequest;
import com.phillippitts.signbridge.service.mediation.MediationService;
import com.phillippitts.signbridge.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.signbridge.service.phrase.NormalizedPhraseCache;
import com.phillippitts.signbridge.service.phrase.PhraseLookupResult;
import com.phillippitts.signbridge.service.pipeline.event.MediationFailedEvent;
import com.phillippitts.signbridge.service.pipeline.event.PipelineCycleCompletedEvent;
import com.phillippitts.signbridge.service.pipeline.event.SpeechFailedEvent;
import com.phillippitts.signbridge.service.speech.SpeechOutput;
import com.phillippitts.signbridge.service.speech.SpeechRequest;
import com.phillippitts.signbridge.service.speech.VoiceProfile;
import com.phillippitts.signbridge.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Sequences one input at a time from recognition to output.
 *
 * <p><b>Fast path:</b> with emergency mode on, the input's phrase is looked up in the
 * emergency table, then the medical table. A hit emits UNDERSTANDING, RESPONDING and
 * SPEAKING back to back on the calling thread and delivers the pre-mediated text.
 * Mediation is not called.
 *
 * <p><b>Slow path:</b> otherwise the mediation service is called with a timeout. Its
 * completion is handled on the pipeline executor. A failure, a timeout or a blank result
 * delivers the raw input, trimmed but otherwise unchanged, instead (degraded SPEAKING) and is reported on the error channel
 * and as a {@link MediationFailedEvent}; it never fails the returned future.
 *
 * <p><b>Output:</b> reaching SPEAKING signals the {@link IdleStateManager}, publishes a
 * subtitle and then speaks the text ({@code deaf-to-hearing}) or attaches the cached avatar
 * animation for it ({@code hearing-to-deaf}). The cycle ends in IDLE when speech ends,
 * or immediately for avatar output.
 *
 * <p><b>Supersession:</b> a new {@link #processInput} cancels the cycle in flight: speech
 * output is cancelled, the old future completes as {@link ResolutionPath#SUPERSEDED} and
 * none of its later statuses, subtitles, errors, history entries or speech reach anyone.
 * A mediation call already issued is left to finish; its result is dropped.
 * {@link #cancel()} does the same without starting a new cycle.
 *
 * <p><b>Thread Safety:</b> all public methods are thread-safe. Channel deliveries happen
 * on the thread that caused them, under the cycle lock.
 *
 * @since 1.0
 * @see MediationPipelineControllerBuilder
 */
public class MediationPipelineController {

    private static final Logger LOG = LogManager.getLogger(MediationPipelineController.class);

    private final NormalizedPhraseCache emergencyPhrases;
    private final NormalizedPhraseCache medicalPhrases;
    private final AvatarContentCache contentCache;
    private final IdleStateManager idleStateManager;
    private final MediationService mediationService;
    private final SpeechOutput speechOutput;
    private final PipelineProperties properties;
    private final Executor pipelineExecutor;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetricsPublisher metrics;
    private final Clock clock;

    private final EventChannel<StatusUpdate> statusChannel = new EventChannel<>("status");
    private final EventChannel<SubtitleUpdate> subtitleChannel = new EventChannel<>("subtitle");
    private final EventChannel<PipelineError> errorChannel = new EventChannel<>("error");
    private final CycleTracker tracker;
    private final Deque<String> history = new ArrayDeque<>();

    MediationPipelineController(NormalizedPhraseCache emergencyPhrases,
                                NormalizedPhraseCache medicalPhrases,
                                AvatarContentCache contentCache,
                                IdleStateManager idleStateManager,
                                MediationService mediationService,
                                SpeechOutput speechOutput,
                                PipelineProperties properties,
                                Executor pipelineExecutor,
                                ApplicationEventPublisher publisher,
                                PipelineMetricsPublisher metrics,
                                Clock clock) {
        this.emergencyPhrases = emergencyPhrases;
        this.medicalPhrases = medicalPhrases;
        this.contentCache = contentCache;
        this.idleStateManager = idleStateManager;
        this.mediationService = mediationService;
        this.speechOutput = speechOutput;
        this.properties = properties;
        this.pipelineExecutor = pipelineExecutor;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
        this.tracker = new CycleTracker(statusChannel, clock);
    }

    /**
     * Processes one input event, superseding any cycle in flight.
     *
     * @param input                 recognized speech or signs
     * @param context               conversation direction and scenario
     * @param emergencyModeEnabled  whether the phrase tables may short-circuit mediation
     * @return future completing once the cycle has reached SPEAKING, or was ignored or
     *         superseded; never completes exceptionally for mediation or speech failures
     */
    public CompletableFuture<PipelineOutcome> processInput(InputEvent input, PipelineContext context,
                                                           boolean emergencyModeEnabled) {
        if (input == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }

        Cycle cycle = tracker.begin(context);
        cancelSpeech();
        cycle.outcome().thenAccept(outcome -> {
            if (outcome.path() == ResolutionPath.SUPERSEDED) {
                metrics.recordSuperseded();
            }
        });

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(cycle.mdc())) {
            String phrase = input.derivedPhrase();
            LOG.info("Cycle started: modality={}, emergencyMode={}, {}", input.modality(),
                    emergencyModeEnabled, LogSanitizer.describe(phrase));

            if (phrase == null || phrase.isBlank()) {
                tracker.advance(cycle, PipelineStatus.IDLE);
                cycle.complete(PipelineOutcome.ignored(cycle.id(), elapsedMillis(cycle)));
                LOG.debug("Blank input ignored");
                return cycle.outcome().copy();
            }

            if (emergencyModeEnabled) {
                Optional<PhraseEntry> hit = lookupFastPath(phrase);
                if (hit.isPresent()) {
                    tracker.advance(cycle, PipelineStatus.UNDERSTANDING);
                    tracker.advance(cycle, PipelineStatus.RESPONDING);
                    deliver(cycle, hit.get().mediatedText(), ResolutionPath.FAST_PATH);
                    return cycle.outcome().copy();
                }
            }

            tracker.advance(cycle, PipelineStatus.UNDERSTANDING);
            startMediation(cycle, phrase);
            return cycle.outcome().copy();
        }
    }

    /**
     * Abandons the cycle in flight without starting a new one, e.g. on a mode or scenario
     * change. Its future completes as {@link ResolutionPath#SUPERSEDED}, speech output is
     * cancelled and observers get a terminal IDLE. Nothing of the cycle is emitted after that.
     *
     * @return true if a cycle was in flight
     */
    public boolean cancel() {
        Optional<UUID> cancelled = tracker.cancel();
        if (cancelled.isEmpty()) {
            return false;
        }
        cancelSpeech();
        LOG.info("Cycle {} cancelled", cancelled.get());
        return true;
    }

    /**
     * True from a new input until its cycle reaches IDLE (speech included).
     */
    public boolean isProcessing() {
        return tracker.isProcessing();
    }

    public Subscription onStatus(Consumer<? super StatusUpdate> subscriber) {
        return statusChannel.subscribe(subscriber);
    }

    public Subscription onSubtitle(Consumer<? super SubtitleUpdate> subscriber) {
        return subtitleChannel.subscribe(subscriber);
    }

    public Subscription onError(Consumer<? super PipelineError> subscriber) {
        return errorChannel.subscribe(subscriber);
    }

    public PipelineStatus getCurrentStatus() {
        return tracker.currentStatus();
    }

    public Optional<UUID> getCurrentCycleId() {
        return tracker.currentCycleId();
    }

    /**
     * Delivered utterances passed to mediation as history, oldest first.
     */
    public List<String> getRecentHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    private Optional<PhraseEntry> lookupFastPath(String phrase) {
        PhraseLookupResult emergency = emergencyPhrases.lookup(phrase);
        if (emergency.hit()) {
            LOG.debug("Emergency phrase hit in {} us", emergency.lookupTimeMicros());
            return emergency.entryIfHit();
        }
        PhraseLookupResult medical = medicalPhrases.lookup(phrase);
        if (medical.hit()) {
            LOG.debug("Medical phrase hit in {} us", medical.lookupTimeMicros());
        }
        return medical.entryIfHit();
    }

    private void startMediation(Cycle cycle, String phrase) {
        MediationRequest request = new MediationRequest(phrase, cycle.context(), getRecentHistory());
        long timeoutMs = properties.effectiveMediationTimeoutMs();

        CompletableFuture<MediationResult> call;
        try {
            call = mediationService.mediate(request);
            if (call == null) {
                call = CompletableFuture.failedFuture(
                        new MediationException("Mediation returned no future", mediationService.getName()));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        call.copy()
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handleAsync((result, error) -> {
                    onMediationComplete(cycle, phrase, result, error);
                    return null;
                }, pipelineExecutor);
    }

    private void onMediationComplete(Cycle cycle, String phrase, MediationResult result, Throwable error) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(cycle.mdc())) {
            if (!tracker.isCurrent(cycle)) {
                LOG.debug("Dropping mediation result of superseded cycle");
                return;
            }
            try {
                resolveMediation(cycle, phrase, result, error);
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure completing cycle; delivering raw input", e);
                tracker.advance(cycle, PipelineStatus.IDLE);
                cycle.complete(new PipelineOutcome(cycle.id(), ResolutionPath.FALLBACK, phrase.trim(),
                        elapsedMillis(cycle), null));
            }
        }
    }

    private void resolveMediation(Cycle cycle, String phrase, MediationResult result, Throwable error) {
        Throwable cause = unwrap(error);
        String mediated = null;
        String reason = null;

        if (cause == null) {
            mediated = result == null ? "" : MediatedTextSanitizer.sanitize(result.mediatedText());
            if (mediated.isEmpty()) {
                reason = "invalid";
                cause = new MediationException("Mediation returned blank text", mediationService.getName());
            }
        } else if (cause instanceof TimeoutException || cause instanceof MediationTimeoutException) {
            reason = "timeout";
            cause = new MediationTimeoutException(properties.effectiveMediationTimeoutMs(), cause);
        } else {
            reason = "error";
        }

        if (cause != null) {
            reportMediationFailure(cycle, reason, cause);
            tracker.advance(cycle, PipelineStatus.RESPONDING);
            deliver(cycle, phrase.trim(), ResolutionPath.FALLBACK);
            return;
        }

        tracker.advance(cycle, PipelineStatus.RESPONDING);
        deliver(cycle, mediated, ResolutionPath.MEDIATED);
        if (properties.isLearnFromMediation() && medicalPhrases.isMutable()) {
            learn(phrase, mediated, result.confidence());
        }
    }

    private void learn(String phrase, String mediated, double confidence) {
        try {
            medicalPhrases.addTerm(phrase, mediated, null, confidence);
        } catch (IllegalArgumentException e) {
            LOG.debug("Not learning phrase: {}", e.getMessage());
        }
    }

    private void deliver(Cycle cycle, String text, ResolutionPath path) {
        if (!tracker.advance(cycle, PipelineStatus.SPEAKING)) {
            return;
        }
        idleStateManager.signalActivity();

        long elapsed = elapsedMillis(cycle);
        boolean overBudget = path == ResolutionPath.FAST_PATH && elapsed > properties.getEmergencyBudgetMs();
        if (overBudget) {
            LOG.warn("Fast path took {} ms, budget is {} ms", elapsed, properties.getEmergencyBudgetMs());
        }

        // output starts under the cycle lock, so a newer cycle either sees it and cancels it or drops it
        boolean delivered = tracker.runIfCurrent(cycle, () -> {
            subtitleChannel.publish(new SubtitleUpdate(cycle.id(), text, cycle.context().mode(),
                    path == ResolutionPath.FALLBACK, clock.instant()));
            remember(text);
            publisher.publishEvent(new PipelineCycleCompletedEvent(cycle.id(), path, elapsed, clock.instant()));
            if (cycle.context().mode() == MediationMode.DEAF_TO_HEARING) {
                speak(cycle, text);
            }
        });
        if (!delivered) {
            LOG.debug("Cycle superseded before output; dropping {}", LogSanitizer.describe(text));
            return;
        }
        metrics.recordCycle(path.metricTag(), elapsed, overBudget);
        LOG.info("Cycle speaking via {} after {} ms ({})", path.metricTag(), elapsed, LogSanitizer.describe(text));

        AvatarAnimation animation = null;
        if (cycle.context().mode() == MediationMode.HEARING_TO_DEAF) {
            animation = cachedAnimation(cycle, text);
            tracker.advance(cycle, PipelineStatus.IDLE);
        }
        cycle.complete(new PipelineOutcome(cycle.id(), path, text, elapsed, animation));
    }

    private void speak(Cycle cycle, String text) {
        SpeechRequest request = new SpeechRequest(text, cycle.context(),
                VoiceProfile.forScenario(cycle.context().scenario()),
                () -> LOG.debug("Speech started for cycle {}", cycle.id()),
                () -> tracker.advance(cycle, PipelineStatus.IDLE),
                failure -> onSpeechFailure(cycle, failure));
        try {
            speechOutput.speak(request);
        } catch (RuntimeException e) {
            onSpeechFailure(cycle, e);
        }
    }

    private void onSpeechFailure(Cycle cycle, Throwable failure) {
        String message = failure == null ? "unknown" : failure.toString();
        LOG.warn("Speech output failed for cycle {}: {}", cycle.id(), message);
        boolean current = tracker.runIfCurrent(cycle, () -> errorChannel.publish(
                new PipelineError(cycle.id(), PipelineError.Kind.SPEECH_FAILURE, message, clock.instant())));
        if (current) {
            publisher.publishEvent(new SpeechFailedEvent(cycle.id(), message, clock.instant()));
        }
        tracker.advance(cycle, PipelineStatus.IDLE);
    }

    private AvatarAnimation cachedAnimation(Cycle cycle, String text) {
        String key = contentCache.generateTextKey(text, cycle.context().scenario());
        return contentCache.getAvatarAnimation(key).map(CacheEntry::payload).orElse(null);
    }

    private void reportMediationFailure(Cycle cycle, String reason, Throwable cause) {
        String backend = cause instanceof MediationException me && !"unknown".equals(me.getBackend())
                ? me.getBackend()
                : mediationService.getName();
        LOG.warn("Mediation {} ({}): {}; delivering raw input", reason, backend, cause.getMessage());
        metrics.recordMediationFailure(backend, reason);

        PipelineError.Kind kind = "timeout".equals(reason)
                ? PipelineError.Kind.MEDIATION_TIMEOUT
                : PipelineError.Kind.MEDIATION_FAILURE;
        tracker.runIfCurrent(cycle, () -> errorChannel.publish(
                new PipelineError(cycle.id(), kind, cause.getMessage(), clock.instant())));
        publisher.publishEvent(new MediationFailedEvent(cycle.id(), backend, reason, cause.getMessage(),
                clock.instant()));
    }

    private void remember(String text) {
        int limit = properties.getHistorySize();
        if (limit <= 0) {
            return;
        }
        synchronized (history) {
            history.addLast(text);
            while (history.size() > limit) {
                history.removeFirst();
            }
        }
    }

    private void cancelSpeech() {
        try {
            speechOutput.cancel();
        } catch (RuntimeException e) {
            LOG.warn("Speech cancel failed: {}", e.toString());
        }
    }

    private long elapsedMillis(Cycle cycle) {
        return Duration.between(cycle.startedAt(), clock.instant()).toMillis();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
