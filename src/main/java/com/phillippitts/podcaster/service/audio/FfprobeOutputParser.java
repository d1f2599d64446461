package com.phillippitts.podcaster.service.audio;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.OptionalDouble;

/**
 * Parses {@code ffprobe -of json -show_entries format=duration} output.
 *
 * <p>Expected shape: {@code {"format": {"duration": "12.345000"}}}. ffprobe prints the value as a
 * string; plain numbers are accepted too.
 */
final class FfprobeOutputParser {

    private FfprobeOutputParser() {}

    static OptionalDouble duration(String json) {
        if (json == null || json.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            JSONObject format = new JSONObject(json).optJSONObject("format");
            if (format == null || !format.has("duration")) {
                return OptionalDouble.empty();
            }
            double seconds = Double.parseDouble(format.get("duration").toString());
            if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(seconds);
        } catch (JSONException | NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
