package com.policysonar.alerts;

import java.util.Set;

/**
 * Monitored indicator families, each with its related indicators.
 */
public enum AlertKind {
    SENTIMENT("sentiment", "sentiment_change", Set.of("consumer_confidence", "business_sentiment")),
    INFLATION("inflation", "inflation_rate", Set.of("cpi", "ppi", "wages")),
    GDP("gdp", "gdp_change", Set.of("industrial_production", "retail_sales")),
    EMPLOYMENT("employment", "employment_change", Set.of("unemployment_rate", "labor_force_participation")),
    TRADE("trade", "trade_balance_change", Set.of("import_volume", "export_volume"));

    private final String key;
    private final String metric;
    private final Set<String> relatedIndicators;

    AlertKind(String key, String metric, Set<String> relatedIndicators) {
        this.key = key;
        this.metric = metric;
        this.relatedIndicators = relatedIndicators;
    }

    /** Lowercase name used in configuration, payloads and alert ids. */
    public String key() {
        return key;
    }

    public String metric() {
        return metric;
    }

    public Set<String> relatedIndicators() {
        return relatedIndicators;
    }
}
