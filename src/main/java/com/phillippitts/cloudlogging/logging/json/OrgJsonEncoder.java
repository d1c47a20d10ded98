package com.phillippitts.cloudlogging.logging.json;

import com.phillippitts.cloudlogging.exception.LogEncodingException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default encoder backed by org.json. Field order is not preserved.
 *
 * <p>org.json only reads bean getters, so nested values are first converted to plain maps and
 * lists with {@link JsonEncoders#toPlainTree(Object)}; records then keep their components.
 */
public final class OrgJsonEncoder implements JsonEncoder {

    static final String NAME = "org-json";

    @Override
    public String encode(Map<String, ?> entry) {
        try {
            Map<String, Object> plain = new LinkedHashMap<>();
            entry.forEach((key, value) -> plain.put(key, JsonEncoders.toPlainTree(value)));
            // toString() returns null instead of throwing when a value fails to serialize
            String json = new JSONObject(plain).toString();
            if (json == null) {
                throw new LogEncodingException("Failed to encode log entry", NAME, null);
            }
            return json;
        } catch (JSONException e) {
            throw new LogEncodingException("Failed to encode log entry", NAME, e);
        }
    }
}
