package com.policysonar.alerts;

import java.util.Locale;
import java.util.Optional;

/**
 * ThresholdBands - warning / alert / critical limits for one indicator kind.
 *
 * <p>Limits are written in the metric's own units. When rising values are the bad direction
 * (inflation) both the value and the limits are negated first, so the comparison is always
 * "normalized value &lt;= normalized limit" and the most severe crossed band wins.
 */
public final class ThresholdBands {

    public enum BadDirection { FALLING, RISING }

    public final double warning;
    public final double alert;
    public final double critical;
    public final BadDirection badDirection;

    public ThresholdBands(double warning, double alert, double critical, BadDirection badDirection) {
        this.warning = warning;
        this.alert = alert;
        this.critical = critical;
        this.badDirection = badDirection;

        if (!(normalize(critical) <= normalize(alert) && normalize(alert) <= normalize(warning))) {
            throw new IllegalArgumentException(String.format(
                "Bands must escalate warning -> alert -> critical in the %s direction: %s",
                badDirection.name().toLowerCase(Locale.ROOT), this));
        }
    }

    public static ThresholdBands falling(double warning, double alert, double critical) {
        return new ThresholdBands(warning, alert, critical, BadDirection.FALLING);
    }

    public static ThresholdBands rising(double warning, double alert, double critical) {
        return new ThresholdBands(warning, alert, critical, BadDirection.RISING);
    }

    /**
     * Severity of the most severe band the value crosses; empty when it does not reach warning.
     */
    public Optional<AlertSeverity> severityOf(double value) {
        double v = normalize(value);
        if (v <= normalize(critical)) return Optional.of(AlertSeverity.CRITICAL);
        if (v <= normalize(alert)) return Optional.of(AlertSeverity.HIGH);
        if (v <= normalize(warning)) return Optional.of(AlertSeverity.MEDIUM);
        return Optional.empty();
    }

    private double normalize(double value) {
        return badDirection == BadDirection.RISING ? -value : value;
    }

    @Override
    public String toString() {
        return String.format("ThresholdBands{warning=%s, alert=%s, critical=%s, bad=%s}",
            warning, alert, critical, badDirection);
    }
}
