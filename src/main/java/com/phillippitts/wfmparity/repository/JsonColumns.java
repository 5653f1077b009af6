package com.phillippitts.wfmparity.repository;

import com.phillippitts.wfmparity.domain.MetricDifference;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of the structured columns (metadata, skill coverage, metric differences).
 */
final class JsonColumns {

    private JsonColumns() {}

    static String writeMap(Map<String, ?> map) {
        return map == null || map.isEmpty() ? "{}" : new JSONObject(map).toString();
    }

    static Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return new LinkedHashMap<>(new JSONObject(json).toMap());
    }

    static Map<String, Double> readDoubleMap(String json) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return out;
        }
        JSONObject obj = new JSONObject(json);
        for (String key : obj.keySet()) {
            out.put(key, obj.getDouble(key));
        }
        return out;
    }

    static String writeStrings(List<String> values) {
        return new JSONArray(values == null ? List.of() : values).toString();
    }

    static List<String> readStrings(String json) {
        List<String> out = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return out;
        }
        JSONArray arr = new JSONArray(json);
        for (int i = 0; i < arr.length(); i++) {
            out.add(arr.getString(i));
        }
        return out;
    }

    static String writeDifferences(List<MetricDifference> diffs) {
        JSONArray arr = new JSONArray();
        for (MetricDifference d : diffs) {
            arr.put(new JSONObject()
                    .put("metric", d.metric())
                    .put("reference_value", d.referenceValue())
                    .put("candidate_value", d.candidateValue())
                    .put("difference", d.difference())
                    .put("absolute_difference", d.absoluteDifference())
                    .put("percentage_difference", d.percentageDifference()));
        }
        return arr.toString();
    }

    static List<MetricDifference> readDifferences(String json) {
        List<MetricDifference> out = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return out;
        }
        JSONArray arr = new JSONArray(json);
        for (int i = 0; i < arr.length(); i++) {
            JSONObject o = arr.getJSONObject(i);
            out.add(new MetricDifference(
                    o.getString("metric"),
                    o.getDouble("reference_value"),
                    o.getDouble("candidate_value"),
                    o.getDouble("difference"),
                    o.getDouble("absolute_difference"),
                    o.getDouble("percentage_difference")));
        }
        return out;
    }
}
