package com.policysonar.retrieval;

import java.util.List;
import java.util.Set;

/**
 * The three historical policies shipped with the sample corpus.
 */
public final class PolicyFixtures {

    public static final PolicyRecord STEEL_TARIFF = new PolicyRecord("1",
        "Tariff increase of 25% on imported steel and aluminum", 2018, "Trade", "National",
        Set.of("trade retaliation", "price inflation"),
        "2.6% price increase in construction sector, -0.2% employment in manufacturing");

    public static final PolicyRecord RENEWABLE_CREDIT = new PolicyRecord("2",
        "Tax credit of 30% for renewable energy investments", 2009, "Energy", "National",
        Set.of("budget deficit", "market distortion"),
        "12% growth in renewable sector, +3.1% in green energy jobs");

    public static final PolicyRecord MINIMUM_WAGE = new PolicyRecord("3",
        "Minimum wage increase to $15 per hour", 2021, "Labor", "State",
        Set.of("small business impact", "inflation"),
        "10% wage increase for bottom quartile, 2% reduction in low-wage employment");

    public static List<PolicyRecord> sampleCorpus() {
        return List.of(STEEL_TARIFF, RENEWABLE_CREDIT, MINIMUM_WAGE);
    }

    public static PolicyRecord record(String id, String text) {
        return new PolicyRecord(id, text, 2020, "General", "National", Set.of(), "");
    }

    private PolicyFixtures() {}
}
