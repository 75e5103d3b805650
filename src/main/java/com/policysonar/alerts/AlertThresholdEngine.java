package com.policysonar.alerts;

import com.policysonar.external.AnalysisSource;
import com.policysonar.external.IndicatorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * AlertThresholdEngine - Converts indicator readings into severity-graded alerts.
 *
 * <p>News sentiment is aggregated with a linear 30-day decay and compared as a deviation from
 * the neutral 0.5 baseline; economic deltas are compared directly against their bands.
 */
public class AlertThresholdEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertThresholdEngine.class);

    public static final int DECAY_WINDOW_DAYS = 30;
    public static final double NEUTRAL_BASELINE = 0.5;

    private static final DateTimeFormatter ALERT_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    // 2024-05-01, 2024-05-01T10:15:30 or 2024-05-01T10:15:30Z / +02:00
    private static final DateTimeFormatter SOURCE_DATE = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalEnd()
        .toFormatter();

    private static final String GENERIC_TEMPLATE = "%1$s changed by %2$s (threshold: %3$s)";
    private static final Map<AlertKind, String> TEMPLATES = new EnumMap<>(AlertKind.class);

    static {
        TEMPLATES.put(AlertKind.SENTIMENT, "Policy sentiment changed by %2$s (threshold: %3$s)");
        TEMPLATES.put(AlertKind.INFLATION, "Inflation impact detected: %2$s (threshold: %3$s)");
    }

    private final AlertThresholds thresholds;
    private final Clock clock;

    public AlertThresholdEngine(AlertThresholds thresholds) {
        this(thresholds, Clock.systemUTC());
    }

    public AlertThresholdEngine(AlertThresholds thresholds, Clock clock) {
        this.thresholds = thresholds;
        this.clock = clock;
    }

    public List<Alert> checkSentiment(String policyId, List<AnalysisSource> sources) {
        OptionalDouble aggregate = aggregateSentiment(sources);
        if (aggregate.isEmpty()) {
            return List.of();
        }
        double deviation = aggregate.getAsDouble() - NEUTRAL_BASELINE;
        return evaluate(policyId, AlertKind.SENTIMENT, deviation).map(List::of).orElse(List.of());
    }

    public List<Alert> checkIndicators(String policyId, IndicatorSnapshot snapshot) {
        List<Alert> alerts = new ArrayList<>();
        for (Map.Entry<AlertKind, Double> entry : snapshot.changes().entrySet()) {
            evaluate(policyId, entry.getKey(), entry.getValue()).ifPresent(alerts::add);
        }
        return alerts;
    }

    /**
     * Decay-weighted mean sentiment. Sources at or beyond the decay window, and sources whose
     * date cannot be read, carry no weight; empty when nothing carries weight.
     */
    public OptionalDouble aggregateSentiment(List<AnalysisSource> sources) {
        Instant now = clock.instant();
        double totalWeight = 0.0;
        double weighted = 0.0;

        for (AnalysisSource source : sources) {
            Optional<Instant> published = parseDate(source.date);
            if (published.isEmpty()) {
                log.warn("Ignoring news source with unreadable date '{}'", source.date);
                continue;
            }
            double weight = decayWeight(published.get(), now);
            if (weight <= 0.0) continue;

            weighted += source.sentiment * weight;
            totalWeight += weight;
        }
        return totalWeight == 0.0 ? OptionalDouble.empty() : OptionalDouble.of(weighted / totalWeight);
    }

    /**
     * max(0, 1 - ageDays / 30) with age counted in whole days; future dates count as age 0.
     */
    public double decayWeight(Instant published, Instant now) {
        long ageDays = Math.max(0L, Duration.between(published, now).toDays());
        return Math.max(0.0, 1.0 - (double) ageDays / DECAY_WINDOW_DAYS);
    }

    public Optional<Alert> evaluate(String policyId, AlertKind kind, double value) {
        return evaluate(policyId, kind, kind.metric(), value);
    }

    public Optional<Alert> evaluate(String policyId, AlertKind kind, String metric, double value) {
        Optional<ThresholdBands> bands = thresholds.forKind(kind);
        if (bands.isEmpty()) {
            return Optional.empty();
        }
        return bands.get().severityOf(value)
            .map(severity -> createAlert(policyId, kind, metric, value, bands.get().warning, severity));
    }

    String formatMessage(AlertKind kind, String metric, double value, double threshold) {
        String template = TEMPLATES.getOrDefault(kind, GENERIC_TEMPLATE);
        return String.format(Locale.ROOT, template, metric, percent(value), percent(threshold));
    }

    private Alert createAlert(String policyId, AlertKind kind, String metric, double value,
                              double threshold, AlertSeverity severity) {
        Instant now = clock.instant();
        String id = "ALERT-" + ALERT_ID_TIME.format(now.atZone(clock.getZone())) + "-" + kind.key();

        Alert alert = new Alert(id, policyId, kind, metric, value, threshold, severity,
            formatMessage(kind, metric, value, threshold), kind.relatedIndicators(), now);
        log.info("{} alert for policy {}: {}", severity, policyId, alert.message);
        return alert;
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100.0);
    }

    private Optional<Instant> parseDate(String date) {
        if (date == null || date.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = SOURCE_DATE.parseBest(date.trim(),
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            if (parsed instanceof LocalDateTime) {
                return Optional.of(((LocalDateTime) parsed).atZone(clock.getZone()).toInstant());
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(clock.getZone()).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
