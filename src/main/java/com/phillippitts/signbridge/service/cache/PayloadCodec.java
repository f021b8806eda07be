package com.phillippitts.signbridge.service.cache;

import org.json.JSONObject;

/**
 * Converts cache payloads to and from the JSON form written to the durable store.
 *
 * @param <T> payload type
 */
public interface PayloadCodec<T> {

    JSONObject encode(T payload);

    /**
     * @throws org.json.JSONException        if required fields are missing
     * @throws IllegalArgumentException if the decoded values violate payload invariants
     */
    T decode(JSONObject json);
}
