package com.phillippitts.signbridge.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvatarAnimationTest {

    @Test
    void acceptsVideoOrAnimationBackend() {
        AvatarAnimation video = AvatarAnimation.ofVideo(List.of("PAIN", "CHEST"), "/avatar/chest-pain.mp4");
        AvatarAnimation rig = AvatarAnimation.ofAnimation(List.of("HELLO"), "{\"frames\":[]}");

        assertThat(video.isVideo()).isTrue();
        assertThat(rig.isVideo()).isFalse();
        assertThat(rig.animationPayload()).isEqualTo("{\"frames\":[]}");
    }

    @Test
    void rejectsBothOrNeitherBackend() {
        assertThatThrownBy(() -> new AvatarAnimation(List.of("A"), "/v.mp4", "{}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Exactly one");
        assertThatThrownBy(() -> new AvatarAnimation(List.of("A"), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copiesSignSequenceDefensively() {
        List<String> signs = new ArrayList<>(List.of("HELP"));
        AvatarAnimation animation = AvatarAnimation.ofVideo(signs, "/help.mp4");
        signs.add("NOW");

        assertThat(animation.signSequence()).containsExactly("HELP");
        assertThat(AvatarAnimation.ofVideo(null, "/x.mp4").signSequence()).isEmpty();
    }
}
