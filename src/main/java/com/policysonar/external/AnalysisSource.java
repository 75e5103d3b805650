package com.policysonar.external;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One source returned by the policy analysis service: a news item or an academic paper.
 * Every field except sentiment may be absent; missing sentiment reads as neutral 0.5.
 */
public final class AnalysisSource {

    public static final double NEUTRAL_SENTIMENT = 0.5;

    public final String id;
    public final String title;
    public final String journal;
    public final Integer year;
    public final String date;       // ISO-8601
    public final double sentiment;  // 0..1
    public final String url;

    public AnalysisSource(String id, String title, String journal, Integer year,
                          String date, double sentiment, String url) {
        this.id = id;
        this.title = title;
        this.journal = journal;
        this.year = year;
        this.date = date;
        this.sentiment = sentiment;
        this.url = url;
    }

    public static AnalysisSource news(String date, double sentiment) {
        return new AnalysisSource(null, null, null, null, date, sentiment, null);
    }

    public static AnalysisSource paper(String title, String journal, int year, double sentiment) {
        return new AnalysisSource(null, title, journal, year, null, sentiment, null);
    }

    static AnalysisSource fromJson(JsonNode json) {
        return new AnalysisSource(
            text(json, "id"),
            text(json, "title"),
            text(json, "journal"),
            json.hasNonNull("year") && json.get("year").canConvertToInt() ? json.get("year").asInt() : null,
            text(json, "date"),
            json.hasNonNull("sentiment") && json.get("sentiment").isNumber()
                ? json.get("sentiment").asDouble() : NEUTRAL_SENTIMENT,
            text(json, "url"));
    }

    private static String text(JsonNode json, String field) {
        return json.hasNonNull(field) ? json.get(field).asText() : null;
    }

    @Override
    public String toString() {
        return String.format("AnalysisSource{title='%s', date='%s', year=%s, sentiment=%.2f}",
            title, date, year, sentiment);
    }
}
