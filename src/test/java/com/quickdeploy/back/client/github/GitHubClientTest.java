package com.quickdeploy.back.client.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickdeploy.back.common.error.ExternalApiException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitHubClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private GitHubClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new GitHubClient(mapper, server.url("/").toString(),
                Duration.ofSeconds(2), Duration.ofSeconds(5), "Quick Deploy test");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void fetchesUserWithTokenHeader() throws Exception {
        server.enqueue(json(200, "{\"login\":\"octocat\",\"name\":\"The Octocat\",\"id\":1}"));

        Optional<GitHubUser> user = client.fetchUser("gho_abc");

        assertThat(user).contains(new GitHubUser("octocat", "The Octocat"));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/user");
        assertThat(request.getHeader("Authorization")).isEqualTo("token gho_abc");
        assertThat(request.getHeader("User-Agent")).isEqualTo("Quick Deploy test");
        assertThat(request.getHeader("X-GitHub-Api-Version")).isEqualTo("2022-11-28");
    }

    @Test
    void rejectedTokenIsAnonymous() {
        server.enqueue(json(401, "{\"message\":\"Bad credentials\"}"));

        assertThat(client.fetchUser("expired")).isEmpty();
    }

    @Test
    void anonymousRepositoryLookupSendsNoCredential() throws Exception {
        server.enqueue(json(200, "{\"name\":\"starter\",\"full_name\":\"fastly/starter\",\"is_template\":true,"
                + "\"owner\":{\"login\":\"fastly\"},\"stargazers_count\":12}"));

        GitHubRepository repository = client.fetchRepository(null, "fastly/starter").orElseThrow();

        assertThat(repository.getNwo()).isEqualTo("fastly/starter");
        assertThat(repository.isTemplate()).isTrue();
        assertThat(repository.getStargazersCount()).isEqualTo(12);
        assertThat(server.takeRequest().getHeader("Authorization")).isNull();
    }

    @Test
    void missingRepositoryIsEmpty() {
        server.enqueue(json(404, "{\"message\":\"Not Found\"}"));

        assertThat(client.fetchRepository(null, "fastly/nope")).isEmpty();
    }

    @Test
    void generatesFromTemplate() throws Exception {
        server.enqueue(json(201, "{\"name\":\"my-app\",\"full_name\":\"octocat/my-app\"}"));

        GitHubRepository created = client.generateFromTemplate("gho_abc", "fastly/starter", "my-app");

        assertThat(created.getNwo()).isEqualTo("octocat/my-app");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/repos/fastly/starter/generate");
        assertThat(mapper.readTree(request.getBody().readUtf8()).path("name").asText()).isEqualTo("my-app");
    }

    @Test
    void decodesFileContent() {
        String encoded = Base64.getMimeEncoder(60, "\n".getBytes(StandardCharsets.UTF_8))
                .encodeToString("name = \"starter\"\nservice_id = \"\"\n# a long enough comment to wrap".getBytes(StandardCharsets.UTF_8));
        server.enqueue(json(200, "{\"path\":\"fastly.toml\",\"sha\":\"abc123\",\"content\":"
                + quote(encoded) + ",\"encoding\":\"base64\"}"));

        GitHubFile file = client.getFile("gho_abc", "octocat/my-app", "fastly.toml").orElseThrow();

        assertThat(file.getSha()).isEqualTo("abc123");
        assertThat(file.getContent()).isEqualTo("name = \"starter\"\nservice_id = \"\"\n# a long enough comment to wrap");
    }

    @Test
    void updatesFileAgainstKnownSha() throws Exception {
        server.enqueue(json(200, "{\"content\":{}}"));

        client.updateFile("gho_abc", "octocat/my-app", "fastly.toml", "service_id = \"svc\"\n", "abc123", "Provision");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/repos/octocat/my-app/contents/fastly.toml");
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("sha").asText()).isEqualTo("abc123");
        assertThat(body.path("message").asText()).isEqualTo("Provision");
        assertThat(new String(Base64.getDecoder().decode(body.path("content").asText()), StandardCharsets.UTF_8))
                .isEqualTo("service_id = \"svc\"\n");
    }

    @Test
    void storesSecretWithKeyId() throws Exception {
        server.enqueue(json(200, "{\"key_id\":\"568250167242549743\",\"key\":\"AAAA\"}"));
        server.enqueue(new MockResponse().setResponseCode(201));

        RepositoryPublicKey key = client.getRepositoryPublicKey("gho_abc", "octocat/my-app");
        client.putSecret("gho_abc", "octocat/my-app", "FASTLY_API_TOKEN", key.getKeyId(), "c2VhbGVk");

        assertThat(key.getKeyId()).isEqualTo("568250167242549743");
        assertThat(server.takeRequest().getPath()).isEqualTo("/repos/octocat/my-app/actions/secrets/public-key");
        RecordedRequest put = server.takeRequest();
        assertThat(put.getPath()).isEqualTo("/repos/octocat/my-app/actions/secrets/FASTLY_API_TOKEN");
        JsonNode body = mapper.readTree(put.getBody().readUtf8());
        assertThat(body.path("encrypted_value").asText()).isEqualTo("c2VhbGVk");
        assertThat(body.path("key_id").asText()).isEqualTo("568250167242549743");
    }

    @Test
    void providerErrorBodyIsReportedVerbatim() {
        server.enqueue(json(422, "{\"message\":\"Name already exists on this account\"}"));

        assertThatThrownBy(() -> client.generateFromTemplate("gho_abc", "fastly/starter", "taken"))
                .hasMessageContaining("Name already exists on this account")
                .isInstanceOfSatisfying(ExternalApiException.class,
                        e -> assertThat(e.getProviderStatus()).isEqualTo(422));
    }

    @Test
    void enablesWorkflow() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        client.enableWorkflow("gho_abc", "octocat/my-app", "deploy.yml");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/repos/octocat/my-app/actions/workflows/deploy.yml/enable");
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static String quote(String value) {
        return "\"" + value.replace("\n", "\\n") + "\"";
    }
}
