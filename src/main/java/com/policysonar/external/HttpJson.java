package com.policysonar.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policysonar.errors.ExternalServiceException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Executes a JSON request with a per-call timeout and maps every failure mode
 * onto {@link ExternalServiceException}.
 */
final class HttpJson {

    private HttpJson() {}

    static JsonNode execute(OkHttpClient httpClient, ObjectMapper mapper, Request request, Duration timeout)
            throws ExternalServiceException {
        OkHttpClient client = httpClient.newBuilder()
            .callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .build();

        String target = request.method() + " " + request.url().encodedPath();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";

            if (!response.isSuccessful()) {
                throw new ExternalServiceException(
                    "API request failed: " + response.code() + " - " + payload, response.code(), null);
            }
            return mapper.readTree(payload);

        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Malformed JSON from " + target + ": " + e.getOriginalMessage(), e);
        } catch (InterruptedIOException e) {
            throw new ExternalServiceException(target + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new ExternalServiceException(target + " failed: " + e.getMessage(), e);
        }
    }
}
