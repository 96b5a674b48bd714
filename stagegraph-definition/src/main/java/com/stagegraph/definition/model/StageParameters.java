package com.stagegraph.definition.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Effective parameters of a stage: an insertion-ordered, unmodifiable value map plus an
 * optional {@link SkipMarker}. The map is deep-copied on construction (nested maps and lists
 * included), so a script overlay can never reach back into the manifest's parameters.
 * Null values are kept (YAML {@code ~}).
 */
public final class StageParameters {

    private static final StageParameters EMPTY = new StageParameters(Map.of(), null);

    private final Map<String, Object> values;
    private final SkipMarker skipMarker;

    public StageParameters(Map<String, ?> values, SkipMarker skipMarker) {
        this.values = values != null ? Collections.unmodifiableMap(deepCopy(values)) : Map.of();
        this.skipMarker = skipMarker;
    }

    public static StageParameters empty() {
        return EMPTY;
    }

    public static StageParameters of(Map<String, ?> values) {
        return new StageParameters(values, null);
    }

    /** Parameter values in declaration order. Unmodifiable. */
    public Map<String, Object> getValues() {
        return values;
    }

    public Optional<SkipMarker> getSkipMarker() {
        return Optional.ofNullable(skipMarker);
    }

    public boolean isSkipped() {
        return skipMarker != null;
    }

    /** Returns new parameters where {@code overrides} win over the current values; the skip marker is kept. */
    public StageParameters mergedWith(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides);
        return new StageParameters(merged, skipMarker);
    }

    public StageParameters withSkipMarker(SkipMarker marker) {
        return new StageParameters(values, marker);
    }

    private static Map<String, Object> deepCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : source.entrySet()) {
            copy.put(e.getKey(), copyValue(e.getValue()));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return Collections.unmodifiableMap(deepCopy((Map<String, ?>) value));
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object item : (List<?>) value) {
                list.add(copyValue(item));
            }
            return Collections.unmodifiableList(list);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageParameters that = (StageParameters) o;
        return values.equals(that.values) && Objects.equals(skipMarker, that.skipMarker);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, skipMarker);
    }

    @Override
    public String toString() {
        return "StageParameters{values=" + values + (skipMarker != null ? ", skip=" + skipMarker.getOrigin() : "") + "}";
    }
}
