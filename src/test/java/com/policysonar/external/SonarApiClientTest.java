package com.policysonar.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policysonar.alerts.AlertKind;
import com.policysonar.errors.ExternalServiceException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SonarApiClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private ExecutorService serverExecutor;
    private String baseUrl;

    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> query = new AtomicReference<>();

    private volatile int status = 200;
    private volatile String responseBody = "{}";
    private volatile long delayMillis = 0;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", this::handle);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
        query.set(exchange.getRequestURI().getRawQuery());
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] payload = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    @Test
    void shouldPostAnalysisRequestWithBearerToken() throws Exception {
        // GIVEN
        responseBody = "{\"sources\": [{\"date\": \"2024-06-01\", \"sentiment\": 0.3}]}";
        SonarApiClient client = new SonarApiClient(baseUrl + "/", "secret-key");

        // WHEN
        AnalysisResponse response = client.analyzePolicy("Steel tariff", PolicyAnalysisClient.FOCUS_NEWS, TIMEOUT);

        // THEN
        assertThat(response.sources).singleElement().satisfies(s -> assertThat(s.sentiment).isEqualTo(0.3));
        assertThat(authorization.get()).isEqualTo("Bearer secret-key");
        JsonNode sent = mapper.readTree(requestBody.get());
        assertThat(sent.get("text").asText()).isEqualTo("Steel tariff");
        assertThat(sent.get("focus").asText()).isEqualTo("news");
        assertThat(sent.get("include_historical").asBoolean()).isTrue();
    }

    @Test
    void shouldOmitAuthorizationWithoutKey() throws Exception {
        new SonarApiClient(baseUrl, "").analyzePolicy("Steel tariff", PolicyAnalysisClient.FOCUS_ACADEMIC, TIMEOUT);

        assertThat(authorization.get()).isNull();
    }

    @Test
    void shouldReportNonSuccessStatus() {
        status = 503;
        responseBody = "maintenance";
        SonarApiClient client = new SonarApiClient(baseUrl, "k");

        assertThatThrownBy(() -> client.analyzePolicy("Steel tariff", PolicyAnalysisClient.FOCUS_NEWS, TIMEOUT))
            .isInstanceOf(ExternalServiceException.class)
            .hasMessage("API request failed: 503 - maintenance")
            .satisfies(e -> assertThat(((ExternalServiceException) e).getStatusCode()).isEqualTo(503));
    }

    @Test
    void shouldReportMalformedJson() {
        responseBody = "{not json";
        SonarApiClient client = new SonarApiClient(baseUrl, "k");

        assertThatThrownBy(() -> client.analyzePolicy("Steel tariff", PolicyAnalysisClient.FOCUS_NEWS, TIMEOUT))
            .isInstanceOf(ExternalServiceException.class)
            .hasMessageContaining("Malformed JSON");
    }

    @Test
    void shouldTimeOutSlowService() {
        delayMillis = 1_500;
        SonarApiClient client = new SonarApiClient(baseUrl, "k");

        assertThatThrownBy(() -> client.analyzePolicy("Steel tariff", PolicyAnalysisClient.FOCUS_NEWS,
                Duration.ofMillis(200)))
            .isInstanceOf(ExternalServiceException.class)
            .hasMessageContaining("timed out");
    }

    @Test
    void shouldQueryIndicatorsByPolicyType() throws Exception {
        responseBody = "{\"inflation\": {\"change\": 0.025}, \"employment\": {\"change\": -0.003}}";
        HttpEconomicIndicatorClient client = new HttpEconomicIndicatorClient(baseUrl);

        IndicatorSnapshot snapshot = client.getIndicators("trade", "30d", TIMEOUT);

        assertThat(query.get()).contains("policy_type=trade").contains("timeframe=30d");
        assertThat(snapshot.change(AlertKind.INFLATION)).hasValue(0.025);
        assertThat(snapshot.change(AlertKind.EMPLOYMENT)).hasValue(-0.003);
    }
}
