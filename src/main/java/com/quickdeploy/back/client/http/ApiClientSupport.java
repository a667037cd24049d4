package com.quickdeploy.back.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickdeploy.back.common.error.ExternalApiException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared request plumbing for the provider clients.
 * Sends one request, never retries, and reports non-2xx responses as {@link ExternalApiException}
 * with the provider's body verbatim.
 */
@Slf4j
public abstract class ApiClientSupport {

    protected final HttpClient http;
    protected final ObjectMapper json;
    private final String provider;
    private final Duration requestTimeout;
    private final String userAgent;

    protected ApiClientSupport(String provider, ObjectMapper json, Duration connectTimeout,
                               Duration requestTimeout, String userAgent) {
        this.provider = provider;
        this.json = json;
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    }

    /** Provider specific headers, e.g. the credential header. */
    protected abstract Map<String, String> headers(String token);

    protected HttpRequest.Builder request(String url, String token) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json");
        headers(token).forEach(builder::header);
        return builder;
    }

    protected HttpRequest.BodyPublisher jsonBody(Object body) {
        try {
            return HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize request body for " + provider, e);
        }
    }

    /**
     * Sends the request and returns the raw response whatever its status.
     */
    protected HttpResponse<String> exchange(HttpRequest request, String label) {
        log.debug("{} {} ({})", request.method(), request.uri(), label);
        try {
            HttpResponse<String> resp = http.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("{} response status {}", label, resp.statusCode());
            return resp;
        } catch (IOException e) {
            throw new ExternalApiException(provider, "Unable to " + label + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalApiException(provider, "Interrupted while trying to " + label, e);
        }
    }

    /**
     * Sends the request and fails unless the status is 2xx.
     */
    protected HttpResponse<String> send(HttpRequest request, String label) {
        HttpResponse<String> resp = exchange(request, label);
        if (!isSuccess(resp)) {
            throw failure(resp, label);
        }
        return resp;
    }

    protected <T> T read(HttpResponse<String> resp, Class<T> type, String label) {
        try {
            return json.readValue(resp.body(), type);
        } catch (IOException e) {
            throw unexpected(resp, label, e);
        }
    }

    protected <T> T read(HttpResponse<String> resp, TypeReference<T> type, String label) {
        try {
            return json.readValue(resp.body(), type);
        } catch (IOException e) {
            throw unexpected(resp, label, e);
        }
    }

    private ExternalApiException unexpected(HttpResponse<String> resp, String label, IOException e) {
        return new ExternalApiException(provider, resp.statusCode(),
                "Unexpected response while trying to " + label + ": " + e.getMessage());
    }

    protected ExternalApiException failure(HttpResponse<String> resp, String label) {
        return new ExternalApiException(provider, resp.statusCode(),
                "Unable to " + label + ": " + resp.body());
    }

    protected static boolean isSuccess(HttpResponse<?> resp) {
        return resp.statusCode() >= 200 && resp.statusCode() < 300;
    }

    protected static boolean isUnauthorized(HttpResponse<?> resp) {
        return resp.statusCode() == 401 || resp.statusCode() == 403;
    }

    protected static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
