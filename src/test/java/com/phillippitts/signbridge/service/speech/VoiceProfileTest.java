package com.phillippitts.signbridge.service.speech;

import com.phillippitts.signbridge.domain.Scenario;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoiceProfileTest {

    @Test
    void ratesFollowScenario() {
        assertThat(VoiceProfile.forScenario(Scenario.HOSPITAL).rate()).isEqualTo(0.9);
        assertThat(VoiceProfile.forScenario(Scenario.EMERGENCY).rate()).isEqualTo(1.1);
        assertThat(VoiceProfile.forScenario(Scenario.DEFAULT)).isEqualTo(VoiceProfile.NEUTRAL);
    }

    @Test
    void rejectsOutOfRangeParameters() {
        assertThatThrownBy(() -> new VoiceProfile(0, 1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VoiceProfile(1, 1, 1.2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("volume");
    }
}
