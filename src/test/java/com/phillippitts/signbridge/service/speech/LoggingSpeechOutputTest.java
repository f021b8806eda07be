package com.phillippitts.signbridge.service.speech;

import com.phillippitts.signbridge.domain.MediationMode;
import com.phillippitts.signbridge.domain.PipelineContext;
import com.phillippitts.signbridge.domain.Scenario;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LoggingSpeechOutputTest {

    private static final PipelineContext HOSPITAL =
            PipelineContext.of(MediationMode.DEAF_TO_HEARING, Scenario.HOSPITAL);

    private final LoggingSpeechOutput output = new LoggingSpeechOutput();

    @Test
    void reportsStartThenEnd() {
        List<String> calls = new ArrayList<>();

        output.speak(new SpeechRequest("I need a nurse", HOSPITAL, null,
                () -> calls.add("start"), () -> calls.add("end"), t -> calls.add("error")));

        assertThat(calls).containsExactly("start", "end");
    }

    @Test
    void routesCallbackFailureToOnError() {
        AtomicReference<Throwable> error = new AtomicReference<>();
        List<String> calls = new ArrayList<>();

        output.speak(new SpeechRequest("hello", HOSPITAL, null,
                () -> { throw new IllegalStateException("device busy"); },
                () -> calls.add("end"), error::set));

        assertThat(error.get()).isInstanceOf(IllegalStateException.class).hasMessage("device busy");
        assertThat(calls).isEmpty();
    }

    @Test
    void requestDefaultsVoiceFromScenarioAndNoopCallbacks() {
        SpeechRequest request = new SpeechRequest("hi", HOSPITAL, null, null, null, null);

        assertThat(request.voice()).isEqualTo(VoiceProfile.HOSPITAL);
        assertThatCode(() -> output.speak(request)).doesNotThrowAnyException();
        assertThatCode(output::cancel).doesNotThrowAnyException();
    }
}
