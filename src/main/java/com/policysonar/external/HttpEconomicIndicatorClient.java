package com.policysonar.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.policysonar.errors.ExternalServiceException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.time.Duration;

/**
 * HttpEconomicIndicatorClient - Reads indicator deltas from {@code GET /indicators}.
 */
public class HttpEconomicIndicatorClient implements EconomicIndicatorClient {

    private final OkHttpClient httpClient;
    private final ObjectMapper jsonMapper;
    private final HttpUrl baseUrl;

    public HttpEconomicIndicatorClient(String baseUrl) {
        this(new OkHttpClient(), new ObjectMapper(), baseUrl);
    }

    public HttpEconomicIndicatorClient(OkHttpClient httpClient, ObjectMapper jsonMapper, String baseUrl) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid indicator service URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.jsonMapper = jsonMapper;
        this.baseUrl = parsed;
    }

    @Override
    public IndicatorSnapshot getIndicators(String policyType, String timeframe, Duration timeout)
            throws ExternalServiceException {
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegment("indicators")
            .addQueryParameter("policy_type", policyType)
            .addQueryParameter("timeframe", timeframe)
            .build();

        Request request = new Request.Builder().url(url).get().build();
        return IndicatorSnapshot.fromJson(HttpJson.execute(httpClient, jsonMapper, request, timeout));
    }
}
