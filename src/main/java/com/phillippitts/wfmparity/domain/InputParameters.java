package com.phillippitts.wfmparity.domain;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable snapshot of the parameters a job was submitted with.
 *
 * <p>Both engines read the same snapshot. The snapshot is stored as JSON and re-read on every
 * attempt, so it never changes after submission.
 */
public final class InputParameters {

    public static final String OFFERED_CALLS = "offered_calls";
    public static final String AVERAGE_HANDLE_TIME = "average_handle_time";
    public static final String SERVICE_LEVEL_TARGET = "service_level_target";
    public static final String SERVICE_LEVEL_SECONDS = "service_level_seconds";
    public static final String SHRINKAGE = "shrinkage";
    public static final String AVERAGE_PATIENCE_SECONDS = "average_patience_seconds";
    public static final String BLEND_HISTORICAL_VOLUME = "blend_historical_volume";
    public static final String SKILL_REQUIREMENTS = "skill_requirements";

    private final Map<String, Object> values;

    @SuppressWarnings("unchecked")
    private InputParameters(Map<String, Object> values) {
        this.values = (Map<String, Object>) freeze(values);
    }

    /**
     * @throws IllegalArgumentException if a value cannot be represented in JSON, such as a
     *         non-finite number
     */
    public static InputParameters of(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "input parameters must not be null");
        // Round-trip through JSON for a deep, detached copy
        try {
            return new InputParameters(new JSONObject(raw).toMap());
        } catch (JSONException e) {
            throw new IllegalArgumentException("Input parameters are not valid JSON values: " + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static InputParameters fromJson(String json) {
        try {
            return new InputParameters(new JSONObject(json).toMap());
        } catch (JSONException e) {
            throw new IllegalArgumentException("Input parameters are not a JSON object", e);
        }
    }

    public String toJson() {
        return new JSONObject(values).toString();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean contains(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public boolean isNumeric(String key) {
        return values.get(key) instanceof Number;
    }

    public OptionalDouble number(String key) {
        Object v = values.get(key);
        return v instanceof Number n ? OptionalDouble.of(n.doubleValue()) : OptionalDouble.empty();
    }

    public double number(String key, double defaultValue) {
        return number(key).orElse(defaultValue);
    }

    public boolean flag(String key) {
        Object v = values.get(key);
        return v instanceof Boolean b ? b : v != null && "true".equalsIgnoreCase(v.toString());
    }

    public boolean hasSkillRequirements() {
        Object v = values.get(SKILL_REQUIREMENTS);
        if (v instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return v instanceof List<?> l && !l.isEmpty();
    }

    /**
     * Skill requirements in either accepted shape: an object of {@code skill -> share}, or an
     * array of {@code {"skill_code": .., "demand_share": ..}} entries. Entries without a share
     * split the remaining traffic evenly.
     *
     * @throws IllegalArgumentException if an entry is malformed
     */
    public List<SkillRequirement> skillRequirements() {
        Object v = values.get(SKILL_REQUIREMENTS);
        Map<String, Double> shares = new LinkedHashMap<>();
        if (v instanceof Map<?, ?> m) {
            m.forEach((k, share) -> shares.put(String.valueOf(k),
                    share instanceof Number n ? n.doubleValue() : null));
        } else if (v instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> entry) {
                    Object code = entry.get("skill_code") != null ? entry.get("skill_code") : entry.get("skill");
                    if (code == null) {
                        throw new IllegalArgumentException("skill requirement without skill_code: " + entry);
                    }
                    Object share = entry.get("demand_share");
                    shares.put(code.toString(), share instanceof Number n ? n.doubleValue() : null);
                } else if (item != null) {
                    shares.put(item.toString(), null);
                }
            }
        } else {
            return List.of();
        }

        double assigned = shares.values().stream().filter(Objects::nonNull).mapToDouble(Double::doubleValue).sum();
        long unassigned = shares.values().stream().filter(Objects::isNull).count();
        double fill = unassigned == 0 ? 0.0 : Math.max(0.0, 1.0 - assigned) / unassigned;

        List<SkillRequirement> out = new ArrayList<>(shares.size());
        shares.forEach((code, share) -> out.add(new SkillRequirement(code, share == null ? fill : share)));
        return List.copyOf(out);
    }

    /**
     * Returns a copy with {@code key} replaced, leaving this snapshot untouched.
     */
    public InputParameters with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return of(copy);
    }

    // Nested objects and arrays become read-only too
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> copy = new LinkedHashMap<>();
            m.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> l) {
            List<Object> copy = new ArrayList<>(l.size());
            l.forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InputParameters other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }
}
