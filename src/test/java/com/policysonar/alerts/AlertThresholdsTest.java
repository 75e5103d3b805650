package com.policysonar.alerts;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertThresholdsTest {

    @Test
    void shouldLoadBundledBands() {
        AlertThresholds thresholds = AlertThresholds.load();

        for (AlertKind kind : AlertKind.values()) {
            assertThat(thresholds.forKind(kind)).as("bands for %s", kind).isPresent();
        }
        ThresholdBands inflation = thresholds.forKind(AlertKind.INFLATION).orElseThrow();
        assertThat(inflation.badDirection).isEqualTo(ThresholdBands.BadDirection.RISING);
        assertThat(inflation.warning).isEqualTo(0.01);
        assertThat(inflation.alert).isEqualTo(0.02);
        assertThat(inflation.critical).isEqualTo(0.03);
        assertThat(thresholds.forKind(AlertKind.SENTIMENT).orElseThrow().critical).isEqualTo(-0.4);
    }

    @Test
    void shouldDefaultToFallingAndSkipUnconfiguredKinds() {
        AlertThresholds thresholds = AlertThresholds.fromConfig(ConfigFactory.parseString(
            "policy-sonar.alerts.bands { trade { warning = -0.02, alert = -0.05, critical = -0.1 } }"));

        assertThat(thresholds.forKind(AlertKind.TRADE))
            .hasValueSatisfying(b -> assertThat(b.badDirection).isEqualTo(ThresholdBands.BadDirection.FALLING));
        assertThat(thresholds.forKind(AlertKind.SENTIMENT)).isEmpty();
    }

    @Test
    void shouldBeEmptyWithoutSection() {
        AlertThresholds thresholds = AlertThresholds.fromConfig(ConfigFactory.empty());

        assertThat(thresholds.forKind(AlertKind.GDP)).isEmpty();
    }
}
