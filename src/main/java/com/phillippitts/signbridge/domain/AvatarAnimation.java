package com.phillippitts.signbridge.domain;

import java.util.List;

/**
 * Cached avatar rendering for a piece of text (text → sign sequence).
 *
 * <p>Exactly one rendering backend is populated: a pre-rendered video path for the
 * video avatar, or an opaque serialized animation payload for the 3D avatar.
 *
 * @param signSequence     ordered gloss tokens
 * @param videoPath        video asset path, or null
 * @param animationPayload opaque serialized animation data, or null
 */
public record AvatarAnimation(List<String> signSequence, String videoPath, String animationPayload) {

    public AvatarAnimation {
        signSequence = signSequence == null ? List.of() : List.copyOf(signSequence);
        if ((videoPath == null) == (animationPayload == null)) {
            throw new IllegalArgumentException(
                    "Exactly one of videoPath or animationPayload must be set");
        }
    }

    public static AvatarAnimation ofVideo(List<String> signSequence, String videoPath) {
        return new AvatarAnimation(signSequence, videoPath, null);
    }

    public static AvatarAnimation ofAnimation(List<String> signSequence, String animationPayload) {
        return new AvatarAnimation(signSequence, null, animationPayload);
    }

    public boolean isVideo() {
        return videoPath != null;
    }
}
