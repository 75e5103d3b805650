package com.policysonar.alerts;

import java.time.Instant;
import java.util.Set;

/**
 * An indicator reading that crossed at least the warning band for its kind.
 */
public final class Alert {
    public final String id;
    public final String policyId;
    public final AlertKind kind;
    public final String metric;
    public final double currentValue;
    public final double threshold;
    public final AlertSeverity severity;
    public final String message;
    public final Set<String> relatedIndicators;
    public final Instant timestamp;

    public Alert(String id, String policyId, AlertKind kind, String metric, double currentValue,
                 double threshold, AlertSeverity severity, String message,
                 Set<String> relatedIndicators, Instant timestamp) {
        this.id = id;
        this.policyId = policyId;
        this.kind = kind;
        this.metric = metric;
        this.currentValue = currentValue;
        this.threshold = threshold;
        this.severity = severity;
        this.message = message;
        this.relatedIndicators = Set.copyOf(relatedIndicators);
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return String.format("Alert{id='%s', policy='%s', kind=%s, severity=%s, value=%.4f, message='%s'}",
            id, policyId, kind, severity, currentValue, message);
    }
}
