package com.phillippitts.querybridge.service.worker;

import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.WorkerAnswer;
import com.phillippitts.querybridge.exception.WorkerExecutionException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Line-delimited JSON protocol spoken with the worker over stdin/stdout.
 *
 * <p>Request (one line on stdin):
 * <pre>
 * {"query":"...","userId":"...","conversationHistory":[{"role":"user","content":"..."}]}
 * </pre>
 *
 * <p>Responses (one line on stdout per request, in request order):
 * <pre>
 * {"success":true,"answer":"...","contexts":[...],"metadata":{...}}
 * {"success":false,"error":{"message":"...","code":"PROCESS_ERROR"}}
 * </pre>
 *
 * <p>Readiness (once, right after start): {@code {"success":true,"message":"Ready"}}.
 *
 * <p>Requests carry no id: the n-th response answers the n-th request. Callers must never
 * write a second request before the previous response has been read.
 */
final class WorkerProtocol {

    static final String READY_MESSAGE = "Ready";

    private WorkerProtocol() {
    }

    static String encodeRequest(String query, String callerId, List<ContextTurn> context) {
        JSONArray history = new JSONArray();
        if (context != null) {
            for (ContextTurn turn : context) {
                history.put(new JSONObject()
                        .put("role", turn.role())
                        .put("content", turn.content()));
            }
        }
        return new JSONObject()
                .put("query", query)
                .put("userId", callerId)
                .put("conversationHistory", history)
                .toString();
    }

    /**
     * Parses one stdout line.
     *
     * @return the JSON object, or empty when the line is not a JSON object
     */
    static Optional<JSONObject> parseLine(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            return Optional.of(new JSONObject(trimmed));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }

    static boolean isReady(JSONObject message) {
        return message.optBoolean("success", false)
                && READY_MESSAGE.equals(message.optString("message", null));
    }

    /**
     * Converts a response line into an answer.
     *
     * @throws WorkerExecutionException when the worker reported {@code success:false}
     */
    static WorkerAnswer decodeResponse(JSONObject response) {
        if (!response.optBoolean("success", false)) {
            JSONObject error = response.optJSONObject("error");
            String message = error == null ? "Unknown worker error"
                    : error.optString("message", "Unknown worker error");
            Map<String, String> details = new LinkedHashMap<>();
            if (error != null) {
                for (String key : error.keySet()) {
                    if (!"message".equals(key)) {
                        details.put(key, String.valueOf(error.opt(key)));
                    }
                }
            }
            throw new WorkerExecutionException(message, details, null);
        }
        String answer = response.optString("answer", "");
        return new WorkerAnswer(answer, readSources(response), readUsage(response), 0L, true);
    }

    private static List<String> readSources(JSONObject response) {
        JSONArray array = response.optJSONArray("contexts");
        if (array == null) {
            array = response.optJSONArray("sources");
        }
        List<String> sources = new ArrayList<>();
        if (array == null) {
            return sources;
        }
        for (int i = 0; i < array.length(); i++) {
            Object item = array.opt(i);
            if (item != null && item != JSONObject.NULL) {
                sources.add(item.toString());
            }
        }
        return sources;
    }

    private static Map<String, String> readUsage(JSONObject response) {
        JSONObject meta = response.optJSONObject("metadata");
        if (meta == null) {
            meta = response.optJSONObject("usage");
        }
        Map<String, String> usage = new LinkedHashMap<>();
        if (meta == null) {
            return usage;
        }
        for (String key : meta.keySet()) {
            Object value = meta.opt(key);
            if (value != null && value != JSONObject.NULL) {
                usage.put(key, value.toString());
            }
        }
        return usage;
    }
}
