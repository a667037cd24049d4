package com.quickdeploy.back.client.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickdeploy.back.client.http.ApiClientSupport;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * GitHub REST API v3 client
 */
@Slf4j
@Component
public class GitHubClient extends ApiClientSupport implements GitHubApi {

    private final String apiUrl;

    public GitHubClient(ObjectMapper objectMapper,
                        @Value("${quickdeploy.github.api-url:https://api.github.com}") String apiUrl,
                        @Value("${quickdeploy.http.connect-timeout:5s}") Duration connectTimeout,
                        @Value("${quickdeploy.http.request-timeout:30s}") Duration requestTimeout,
                        @Value("${quickdeploy.user-agent:Quick Deploy}") String userAgent) {
        super("GitHub", objectMapper, connectTimeout, requestTimeout, userAgent);
        this.apiUrl = trimTrailingSlash(apiUrl);
    }

    @Override
    protected Map<String, String> headers(String token) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-GitHub-Api-Version", "2022-11-28");
        if (token != null) {
            headers.put("Authorization", "token " + token);
        }
        return headers;
    }

    @Override
    public Optional<GitHubUser> fetchUser(String token) {
        HttpResponse<String> resp = exchange(request(apiUrl + "/user", token).GET().build(),
                "fetch logged in user from GitHub");
        if (isUnauthorized(resp)) {
            log.info("GitHub token rejected with status {}", resp.statusCode());
            return Optional.empty();
        }
        if (!isSuccess(resp)) {
            throw failure(resp, "fetch logged in user from GitHub");
        }
        return Optional.of(read(resp, GitHubUser.class, "fetch logged in user from GitHub"));
    }

    @Override
    public Optional<GitHubRepository> fetchRepository(String token, String nwo) {
        String label = "fetch GitHub repository " + nwo;
        HttpResponse<String> resp = exchange(request(apiUrl + "/repos/" + nwo, token).GET().build(), label);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (!isSuccess(resp)) {
            throw failure(resp, label);
        }
        return Optional.of(read(resp, GitHubRepository.class, label));
    }

    @Override
    public GitHubRepository generateFromTemplate(String token, String templateNwo, String name) {
        String label = "generate repository from template " + templateNwo;
        HttpRequest req = request(apiUrl + "/repos/" + templateNwo + "/generate", token)
                .header("Content-Type", "application/json")
                .POST(jsonBody(Map.of("name", name)))
                .build();
        return read(send(req, label), GitHubRepository.class, label);
    }

    @Override
    public GitHubRepository forkRepository(String token, String nwo, String name) {
        String label = "fork GitHub repository " + nwo;
        HttpRequest req = request(apiUrl + "/repos/" + nwo + "/forks", token)
                .header("Content-Type", "application/json")
                .POST(jsonBody(Map.of("name", name)))
                .build();
        return read(send(req, label), GitHubRepository.class, label);
    }

    @Override
    public Optional<GitHubFile> getFile(String token, String nwo, String path) {
        String label = "fetch " + path + " file from GitHub repository " + nwo;
        HttpResponse<String> resp = exchange(
                request(apiUrl + "/repos/" + nwo + "/contents/" + path, token).GET().build(), label);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (!isSuccess(resp)) {
            throw failure(resp, label);
        }
        ContentsResponse body = read(resp, ContentsResponse.class, label);
        String encoded = body.getContent() == null ? "" : body.getContent().replace("\n", "");
        String content = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        return Optional.of(new GitHubFile(body.getPath(), body.getSha(), content));
    }

    @Override
    public void updateFile(String token, String nwo, String path, String content, String sha, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("content", Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8)));
        body.put("sha", sha);
        HttpRequest req = request(apiUrl + "/repos/" + nwo + "/contents/" + path, token)
                .header("Content-Type", "application/json")
                .PUT(jsonBody(body))
                .build();
        send(req, "update " + path + " in GitHub repository " + nwo);
    }

    @Override
    public void enableWorkflow(String token, String nwo, String workflow) {
        HttpRequest req = request(apiUrl + "/repos/" + nwo + "/actions/workflows/" + workflow + "/enable", token)
                .PUT(HttpRequest.BodyPublishers.noBody())
                .build();
        send(req, "enable workflow " + workflow + " in " + nwo);
    }

    @Override
    public RepositoryPublicKey getRepositoryPublicKey(String token, String nwo) {
        String label = "fetch Actions public key for " + nwo;
        HttpRequest req = request(apiUrl + "/repos/" + nwo + "/actions/secrets/public-key", token)
                .GET()
                .build();
        return read(send(req, label), RepositoryPublicKey.class, label);
    }

    @Override
    public void putSecret(String token, String nwo, String name, String keyId, String encryptedValue) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("encrypted_value", encryptedValue);
        body.put("key_id", keyId);
        HttpRequest req = request(apiUrl + "/repos/" + nwo + "/actions/secrets/" + name, token)
                .header("Content-Type", "application/json")
                .PUT(jsonBody(body))
                .build();
        send(req, "create secret " + name);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Data
    static class ContentsResponse {
        private String path;
        private String sha;
        private String content;
    }
}
