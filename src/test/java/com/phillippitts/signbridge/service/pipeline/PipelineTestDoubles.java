package com.phillippitts.signbridge.service.pipeline;

import com.phillippitts.signbridge.domain.MediationResult;
import com.phillippitts.signbridge.domain.PipelineStatus;
import com.phillippitts.signbridge.service.mediation.MediationRequest;
import com.phillippitts.signbridge.service.mediation.MediationService;
import com.phillippitts.signbridge.service.speech.SpeechOutput;
import com.phillippitts.signbridge.service.speech.SpeechRequest;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared fakes for pipeline controller tests.
 */
final class PipelineTestDoubles {

    private PipelineTestDoubles() {
    }

    /**
     * Mediation backend whose futures are completed by the test.
     */
    static final class ControllableMediation implements MediationService {
        final List<MediationRequest> requests = new CopyOnWriteArrayList<>();
        final List<CompletableFuture<MediationResult>> pending = new CopyOnWriteArrayList<>();
        RuntimeException throwOnCall;

        @Override
        public CompletableFuture<MediationResult> mediate(MediationRequest request) {
            requests.add(request);
            if (throwOnCall != null) {
                throw throwOnCall;
            }
            CompletableFuture<MediationResult> f = new CompletableFuture<>();
            pending.add(f);
            return f;
        }

        @Override
        public String getName() {
            return "controllable";
        }

        void succeed(int index, String text) {
            pending.get(index).complete(new MediationResult(text, 0.9));
        }

        void fail(int index, RuntimeException error) {
            pending.get(index).completeExceptionally(error);
        }
    }

    /**
     * Speech output that records requests and, when {@code autoFinish} is set, reports
     * each utterance finished synchronously.
     */
    static final class RecordingSpeech implements SpeechOutput {
        final List<SpeechRequest> spoken = new CopyOnWriteArrayList<>();
        final AtomicInteger cancels = new AtomicInteger();
        boolean autoFinish = true;
        RuntimeException failWith;

        @Override
        public void speak(SpeechRequest request) {
            spoken.add(request);
            if (failWith != null) {
                request.onError().accept(failWith);
                return;
            }
            if (autoFinish) {
                request.onStart().run();
                request.onEnd().run();
            }
        }

        @Override
        public void cancel() {
            cancels.incrementAndGet();
        }

        SpeechRequest last() {
            return spoken.get(spoken.size() - 1);
        }
    }

    /**
     * Collects channel emissions.
     */
    static final class Recorder {
        final List<StatusUpdate> statuses = new CopyOnWriteArrayList<>();
        final List<SubtitleUpdate> subtitles = new CopyOnWriteArrayList<>();
        final List<PipelineError> errors = new CopyOnWriteArrayList<>();

        Recorder attach(MediationPipelineController controller) {
            controller.onStatus(statuses::add);
            controller.onSubtitle(subtitles::add);
            controller.onError(errors::add);
            return this;
        }

        List<PipelineStatus> statusesOf(UUID cycleId) {
            return statuses.stream().filter(s -> s.cycleId().equals(cycleId)).map(StatusUpdate::status).toList();
        }

        List<PipelineStatus> allStatuses() {
            return statuses.stream().map(StatusUpdate::status).toList();
        }
    }
}
