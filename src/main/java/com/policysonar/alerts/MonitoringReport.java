package com.policysonar.alerts;

import java.util.List;

/**
 * Outcome of one monitoring pass: the alerts raised by checks that completed,
 * and the names of checks that failed or timed out.
 */
public final class MonitoringReport {
    public final String policyId;
    public final List<Alert> alerts;
    public final List<String> failedChecks;

    public MonitoringReport(String policyId, List<Alert> alerts, List<String> failedChecks) {
        this.policyId = policyId;
        this.alerts = List.copyOf(alerts);
        this.failedChecks = List.copyOf(failedChecks);
    }

    public boolean isComplete() {
        return failedChecks.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("MonitoringReport{policy='%s', alerts=%d, failedChecks=%s}",
            policyId, alerts.size(), failedChecks);
    }
}
