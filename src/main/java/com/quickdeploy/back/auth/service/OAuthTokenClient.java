package com.quickdeploy.back.auth.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickdeploy.back.auth.model.OAuthProviderSettings;
import com.quickdeploy.back.client.http.ApiClientSupport;
import com.quickdeploy.back.common.error.AuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Exchanges an authorization code for an access token at a provider's token endpoint.
 */
@Slf4j
@Component
public class OAuthTokenClient extends ApiClientSupport {

    public OAuthTokenClient(ObjectMapper objectMapper,
                            @Value("${quickdeploy.http.connect-timeout:5s}") Duration connectTimeout,
                            @Value("${quickdeploy.http.request-timeout:30s}") Duration requestTimeout,
                            @Value("${quickdeploy.user-agent:Quick Deploy}") String userAgent) {
        super("OAuth", objectMapper, connectTimeout, requestTimeout, userAgent);
    }

    @Override
    protected Map<String, String> headers(String token) {
        return Map.of();
    }

    /**
     * @throws AuthException when the provider answers but refuses the code
     */
    public String exchangeCode(OAuthProviderSettings settings, String code) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", settings.getClientId());
        form.put("client_secret", settings.getClientSecret());
        form.put("code", code);
        form.put("grant_type", "authorization_code");

        HttpRequest req = request(settings.getTokenUrl(), null)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encode(form)))
                .build();
        HttpResponse<String> resp = send(req, "exchange authorization code");

        Map<String, Object> body = read(resp, new TypeReference<Map<String, Object>>() {
        }, "exchange authorization code");
        Object token = body.get("access_token");
        if (token == null || token.toString().isBlank()) {
            Object description = body.getOrDefault("error_description", body.getOrDefault("error", "no access token returned"));
            throw new AuthException("Authorization failed: " + description);
        }
        return token.toString();
    }

    private static String encode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
