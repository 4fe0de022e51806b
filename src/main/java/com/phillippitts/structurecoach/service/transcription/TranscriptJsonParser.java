package com.phillippitts.structurecoach.service.transcription;

import com.phillippitts.structurecoach.domain.TranscriptionResult;
import com.phillippitts.structurecoach.exception.TranscriptionException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses a {@code verbose_json} transcription response.
 *
 * <p>Text comes from the top-level {@code text} field, or the joined segment texts when it
 * is absent. Duration comes from {@code duration}, or the last segment's end.
 */
final class TranscriptJsonParser {

    private TranscriptJsonParser() {}

    static TranscriptionResult parse(String json, String model, long latencyMs) {
        if (json == null || json.isBlank()) {
            throw new TranscriptionException("Empty transcription response", model);
        }
        try {
            JSONObject obj = new JSONObject(json);
            JSONArray segs = obj.optJSONArray("segments");

            String text = obj.optString("text", "").trim();
            if (text.isEmpty() && segs != null) {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < segs.length(); i++) {
                    JSONObject seg = segs.optJSONObject(i);
                    if (seg == null) {
                        continue;
                    }
                    String t = seg.optString("text", "").trim();
                    if (!t.isEmpty()) {
                        if (sb.length() > 0) {
                            sb.append(' ');
                        }
                        sb.append(t);
                    }
                }
                text = sb.toString();
            }

            double duration = obj.optDouble("duration", Double.NaN);
            if (Double.isNaN(duration) && segs != null && segs.length() > 0) {
                JSONObject last = segs.optJSONObject(segs.length() - 1);
                duration = last == null ? 0.0 : last.optDouble("end", 0.0);
            }
            if (Double.isNaN(duration) || duration < 0) {
                duration = 0.0;
            }
            return TranscriptionResult.of(text, duration, model, latencyMs);
        } catch (JSONException e) {
            throw new TranscriptionException("Malformed transcription response: " + e.getMessage(), model, e);
        }
    }
}
