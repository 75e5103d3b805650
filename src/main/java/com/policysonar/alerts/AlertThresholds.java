package com.policysonar.alerts;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Configured threshold bands per alert kind. Kinds without bands never raise alerts.
 *
 * <pre>
 * policy-sonar.alerts.bands {
 *   inflation { warning = 0.01, alert = 0.02, critical = 0.03, bad-direction = rising }
 * }
 * </pre>
 */
public final class AlertThresholds {

    public static final String CONFIG_PATH = "policy-sonar.alerts.bands";

    private final Map<AlertKind, ThresholdBands> bands;

    public AlertThresholds(Map<AlertKind, ThresholdBands> bands) {
        EnumMap<AlertKind, ThresholdBands> copy = new EnumMap<>(AlertKind.class);
        copy.putAll(bands);
        this.bands = Collections.unmodifiableMap(copy);
    }

    public static AlertThresholds load() {
        return fromConfig(ConfigFactory.load());
    }

    public static AlertThresholds fromConfig(Config config) {
        Map<AlertKind, ThresholdBands> bands = new EnumMap<>(AlertKind.class);
        if (!config.hasPath(CONFIG_PATH)) {
            return new AlertThresholds(bands);
        }
        Config section = config.getConfig(CONFIG_PATH);
        for (AlertKind kind : AlertKind.values()) {
            if (!section.hasPath(kind.key())) continue;
            Config c = section.getConfig(kind.key());
            ThresholdBands.BadDirection direction = c.hasPath("bad-direction")
                ? ThresholdBands.BadDirection.valueOf(c.getString("bad-direction").toUpperCase(Locale.ROOT))
                : ThresholdBands.BadDirection.FALLING;
            bands.put(kind, new ThresholdBands(
                c.getDouble("warning"), c.getDouble("alert"), c.getDouble("critical"), direction));
        }
        return new AlertThresholds(bands);
    }

    public Optional<ThresholdBands> forKind(AlertKind kind) {
        return Optional.ofNullable(bands.get(kind));
    }

    @Override
    public String toString() {
        return "AlertThresholds" + bands;
    }
}
