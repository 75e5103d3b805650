package com.policysonar.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.policysonar.alerts.AlertKind;
import com.policysonar.errors.ExternalServiceException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Economic deltas per indicator kind, as reported by the indicator feed.
 */
public final class IndicatorSnapshot {

    private final Map<AlertKind, Double> changes;

    public IndicatorSnapshot(Map<AlertKind, Double> changes) {
        EnumMap<AlertKind, Double> copy = new EnumMap<>(AlertKind.class);
        copy.putAll(changes);
        this.changes = Collections.unmodifiableMap(copy);
    }

    public OptionalDouble change(AlertKind kind) {
        Double value = changes.get(kind);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public Map<AlertKind, Double> changes() {
        return changes;
    }

    /**
     * Reads {@code {"inflation": {"change": 0.012}, "gdp": {...}, ...}}.
     * Unknown keys are ignored; a known key without a numeric change is malformed.
     */
    public static IndicatorSnapshot fromJson(JsonNode json) throws ExternalServiceException {
        if (json == null || !json.isObject()) {
            throw new ExternalServiceException("Indicator response is not a JSON object");
        }
        Map<AlertKind, Double> changes = new EnumMap<>(AlertKind.class);
        for (AlertKind kind : AlertKind.values()) {
            if (kind == AlertKind.SENTIMENT || !json.has(kind.key())) {
                continue;
            }
            JsonNode change = json.get(kind.key()).get("change");
            if (change == null || !change.isNumber()) {
                throw new ExternalServiceException("Indicator '" + kind.key() + "' has no numeric change");
            }
            changes.put(kind, change.asDouble());
        }
        return new IndicatorSnapshot(changes);
    }

    @Override
    public String toString() {
        return "IndicatorSnapshot" + changes;
    }
}
