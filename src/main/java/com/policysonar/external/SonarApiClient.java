package com.policysonar.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.policysonar.errors.ExternalServiceException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * SonarApiClient - HTTP client for the policy analysis API ({@code POST /analyze}).
 */
public class SonarApiClient implements PolicyAnalysisClient {

    private static final Logger log = LoggerFactory.getLogger(SonarApiClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper jsonMapper;
    private final String baseUrl;
    private final String apiKey;

    public SonarApiClient(String baseUrl, String apiKey) {
        this(new OkHttpClient(), new ObjectMapper(), baseUrl, apiKey);
    }

    public SonarApiClient(OkHttpClient httpClient, ObjectMapper jsonMapper, String baseUrl, String apiKey) {
        this.httpClient = httpClient;
        this.jsonMapper = jsonMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;

        if (apiKey == null || apiKey.isEmpty()) {
            log.warn("SONAR_API_KEY is not set; analysis requests will be sent unauthenticated");
        }
    }

    @Override
    public AnalysisResponse analyzePolicy(String policyText, String focus, Duration timeout)
            throws ExternalServiceException {
        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("text", policyText);
        payload.put("focus", focus);
        payload.put("include_historical", true);

        Request.Builder request = new Request.Builder()
            .url(baseUrl + "/analyze")
            .post(RequestBody.create(serialize(payload), JSON));
        if (apiKey != null && !apiKey.isEmpty()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        log.debug("Requesting {} analysis for policy text of {} chars", focus, policyText.length());
        return AnalysisResponse.fromJson(focus, HttpJson.execute(httpClient, jsonMapper, request.build(), timeout));
    }

    private String serialize(ObjectNode payload) throws ExternalServiceException {
        try {
            return jsonMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Could not encode analysis request", e);
        }
    }
}
