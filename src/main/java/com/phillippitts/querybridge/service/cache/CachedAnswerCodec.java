package com.phillippitts.querybridge.service.cache;

import com.phillippitts.querybridge.domain.CachedAnswer;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON (de)serialization of cache payloads:
 * <pre>
 * {"answer":"...","sources":["..."],"cachedAt":"2024-01-01T00:00:00Z"}
 * </pre>
 */
final class CachedAnswerCodec {

    private CachedAnswerCodec() {
    }

    static String encode(CachedAnswer answer) {
        return new JSONObject()
                .put("answer", answer.answer())
                .put("sources", new JSONArray(answer.sources()))
                .put("cachedAt", answer.cachedAt().toString())
                .toString();
    }

    /**
     * @throws JSONException if the payload is not a cache entry
     */
    static CachedAnswer decode(String json) {
        JSONObject object = new JSONObject(json);
        List<String> sources = new ArrayList<>();
        JSONArray array = object.optJSONArray("sources");
        if (array != null) {
            for (int i = 0; i < array.length(); i++) {
                sources.add(array.optString(i, ""));
            }
        }
        String cachedAt = object.optString("cachedAt", null);
        return new CachedAnswer(object.getString("answer"), sources,
                cachedAt == null ? null : Instant.parse(cachedAt));
    }
}
