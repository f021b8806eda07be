package com.phillippitts.signbridge.service.cache;

import com.phillippitts.signbridge.domain.SignRecognition;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/** JSON form of {@link SignRecognition}: {@code {"recognizedSigns": [...], "confidence": 0.9}}. */
public final class SignRecognitionCodec implements PayloadCodec<SignRecognition> {

    @Override
    public JSONObject encode(SignRecognition payload) {
        return new JSONObject()
                .put("recognizedSigns", new JSONArray(payload.recognizedSigns()))
                .put("confidence", payload.confidence());
    }

    @Override
    public SignRecognition decode(JSONObject json) {
        JSONArray signs = json.getJSONArray("recognizedSigns");
        List<String> list = new ArrayList<>(signs.length());
        for (int i = 0; i < signs.length(); i++) {
            list.add(signs.getString(i));
        }
        return new SignRecognition(list, json.getDouble("confidence"));
    }
}
