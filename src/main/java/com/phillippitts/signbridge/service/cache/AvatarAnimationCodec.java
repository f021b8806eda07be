package com.phillippitts.signbridge.service.cache;

import com.phillippitts.signbridge.domain.AvatarAnimation;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of {@link AvatarAnimation}. Only the populated rendering backend is written.
 */
public final class AvatarAnimationCodec implements PayloadCodec<AvatarAnimation> {

    @Override
    public JSONObject encode(AvatarAnimation payload) {
        JSONObject json = new JSONObject().put("signSequence", new JSONArray(payload.signSequence()));
        if (payload.isVideo()) {
            json.put("videoPath", payload.videoPath());
        } else {
            json.put("animationPayload", payload.animationPayload());
        }
        return json;
    }

    @Override
    public AvatarAnimation decode(JSONObject json) {
        JSONArray glosses = json.getJSONArray("signSequence");
        List<String> sequence = new ArrayList<>(glosses.length());
        for (int i = 0; i < glosses.length(); i++) {
            sequence.add(glosses.getString(i));
        }
        return new AvatarAnimation(sequence,
                json.optString("videoPath", null),
                json.optString("animationPayload", null));
    }
}
