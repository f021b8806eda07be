package com.phillippitts.signbridge;

import com.phillippitts.signbridge.domain.MediationMode;
import com.phillippitts.signbridge.domain.PipelineContext;
import com.phillippitts.signbridge.domain.Scenario;
import com.phillippitts.signbridge.domain.SignInput;
import com.phillippitts.signbridge.service.pipeline.MediationPipelineController;
import com.phillippitts.signbridge.service.pipeline.PipelineOutcome;
import com.phillippitts.signbridge.service.pipeline.ResolutionPath;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(
    properties = {
        "cache.store=MEMORY",
        "cache.sweep-interval-ms=3600000"
    }
)
class SignBridgeApplicationTests {

    @Autowired
    private MediationPipelineController pipeline;

    @Test
    void contextLoads() {
        assertThat(pipeline).isNotNull();
    }

    @Test
    void emergencyPhraseTakesFastPath() throws Exception {
        PipelineOutcome outcome = pipeline.processInput(SignInput.ofPhrase("HELP", "Help!"),
                PipelineContext.of(MediationMode.DEAF_TO_HEARING, Scenario.EMERGENCY), true)
                .get(5, TimeUnit.SECONDS);

        assertThat(outcome.path()).isEqualTo(ResolutionPath.FAST_PATH);
        assertThat(outcome.outputText()).isEqualTo("I need help");
    }
}
