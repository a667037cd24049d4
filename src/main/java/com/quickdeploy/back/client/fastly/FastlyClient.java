package com.quickdeploy.back.client.fastly;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickdeploy.back.client.http.ApiClientSupport;
import com.quickdeploy.back.common.error.AuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fastly API client
 */
@Slf4j
@Component
public class FastlyClient extends ApiClientSupport implements FastlyApi {

    private final String apiUrl;

    public FastlyClient(ObjectMapper objectMapper,
                        @Value("${quickdeploy.fastly.api-url:https://api.fastly.com}") String apiUrl,
                        @Value("${quickdeploy.http.connect-timeout:5s}") Duration connectTimeout,
                        @Value("${quickdeploy.http.request-timeout:30s}") Duration requestTimeout,
                        @Value("${quickdeploy.user-agent:Quick Deploy}") String userAgent) {
        super("Fastly", objectMapper, connectTimeout, requestTimeout, userAgent);
        this.apiUrl = trimTrailingSlash(apiUrl);
    }

    @Override
    protected Map<String, String> headers(String token) {
        if (token == null) {
            throw new AuthException("No Fastly API token set");
        }
        return Map.of("Fastly-Key", token);
    }

    @Override
    public Optional<FastlyUser> fetchUser(String token) {
        String label = "authenticate with Fastly";
        HttpResponse<String> resp = exchange(request(apiUrl + "/current_user", token).GET().build(), label);
        if (isUnauthorized(resp)) {
            log.info("Fastly token rejected with status {}", resp.statusCode());
            return Optional.empty();
        }
        if (!isSuccess(resp)) {
            throw failure(resp, label);
        }
        return Optional.of(read(resp, FastlyUser.class, label));
    }

    @Override
    public FastlyService createService(String token, String name) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("type", "wasm");
        body.put("name", name);
        return post(apiUrl + "/service", token, body, FastlyService.class, "create service");
    }

    @Override
    public FastlyDomain createDomain(String token, String serviceId, int version, String name) {
        return post(versionUrl(serviceId, version) + "/domain", token, new FastlyDomain(name),
                FastlyDomain.class, "create domain " + name);
    }

    @Override
    public FastlyBackend createBackend(String token, String serviceId, int version, FastlyBackend backend) {
        return post(versionUrl(serviceId, version) + "/backend", token, backend,
                FastlyBackend.class, "create backend " + backend.getName());
    }

    @Override
    public FastlyDictionary createDictionary(String token, String serviceId, int version, String name) {
        return post(versionUrl(serviceId, version) + "/dictionary", token, new FastlyDictionary(null, name),
                FastlyDictionary.class, "create dictionary " + name);
    }

    @Override
    public void updateDictionaryItems(String token, String serviceId, String dictionaryId,
                                      List<DictionaryItemOperation> items) {
        HttpRequest req = request(apiUrl + "/service/" + serviceId + "/dictionary/" + dictionaryId + "/items", token)
                .header("Content-Type", "application/json")
                .method("PATCH", jsonBody(Map.of("items", items)))
                .build();
        send(req, "add items to dictionary " + dictionaryId);
    }

    @Override
    public FastlyServiceVersion getServiceVersion(String token, String serviceId, int version) {
        String label = "check deployment of service " + serviceId;
        HttpResponse<String> resp = send(request(versionUrl(serviceId, version), token).GET().build(), label);
        return read(resp, FastlyServiceVersion.class, label);
    }

    private <T> T post(String url, String token, Object body, Class<T> type, String label) {
        HttpRequest req = request(url, token)
                .header("Content-Type", "application/json")
                .POST(jsonBody(body))
                .build();
        return read(send(req, label), type, label);
    }

    private String versionUrl(String serviceId, int version) {
        return apiUrl + "/service/" + serviceId + "/version/" + version;
    }
}
