package com.kubeprov.provisioner.step.azure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubeprov.provisioner.step.AzureSettings;
import com.kubeprov.provisioner.step.StepException;
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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * AzureManagementClient against a local HTTP server standing in for both
 * the login endpoint and Resource Manager.
 */
class AzureManagementClientTest {

    static final String GROUP_PATH = "/subscriptions/sub-1/resourcegroups/demo-c1";
    static final String SLOW_PATH  = "/subscriptions/sub-1/resourcegroups/slow";

    HttpServer server;
    AzureManagementClient client;

    final AtomicInteger logins = new AtomicInteger();
    final Map<String, Reply> replies = new ConcurrentHashMap<>();
    final Map<String, String> lastRequest = new ConcurrentHashMap<>();

    record Reply(int status, String body) {}

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/tenant/oauth2/v2.0/token", this::login);
        server.createContext("/subscriptions", this::resource);
        server.start();
        String base = "http://localhost:" + server.getAddress().getPort();
        client = new AzureManagementClient(base, base + "/", Duration.ofMillis(10), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    // ------------------------------------------------------------------
    // Authentication
    // ------------------------------------------------------------------

    @Test
    void accessToken_isFetchedOnce_andReusedForTheSameCredentials() {
        replies.put("GET " + GROUP_PATH, new Reply(200, "{\"name\":\"demo-c1\"}"));

        client.getResource(settings("good"), GROUP_PATH, "2021-04-01");
        client.getResource(settings("good"), GROUP_PATH, "2021-04-01");

        assertThat(logins.get()).isEqualTo(1);
        assertThat(lastRequest.get("authorization")).isEqualTo("Bearer tok");
        assertThat(lastRequest.get("query")).isEqualTo("api-version=2021-04-01");
    }

    @Test
    void accessToken_wrongSecretAfterAGoodOne_isRejectedByLogin() {
        assertThat(client.accessToken(settings("good"))).isEqualTo("tok");

        Throwable thrown = catchThrowable(() -> client.accessToken(settings("WRONG")));

        assertThat(thrown).isInstanceOf(AzureApiException.class).hasMessageContaining("login failed: HTTP 401");
        assertThat(((AzureApiException) thrown).getStatusCode()).isEqualTo(401);
        assertThat(logins.get()).isEqualTo(2);
    }

    @Test
    void cacheKey_neverContainsThePlainSecret() {
        String key = AzureManagementClient.cacheKey(settings("good"));

        assertThat(key).startsWith("tenant/client/").doesNotContain("good");
        assertThat(key).isNotEqualTo(AzureManagementClient.cacheKey(settings("other")));
    }

    @Test
    void accessToken_missingSecret_isConfigurationError() {
        assertThatThrownBy(() -> client.accessToken(settings(" ")))
                .isInstanceOf(StepException.class)
                .hasMessageContaining("azure: clientSecret is required")
                .satisfies(e -> assertThat(((StepException) e).getKind())
                        .isEqualTo(StepException.Kind.CONFIGURATION));
        assertThat(logins.get()).isZero();
    }

    // ------------------------------------------------------------------
    // Resources
    // ------------------------------------------------------------------

    @Test
    void getResource_missing_isEmpty_existing_isParsed() {
        assertThat(client.getResource(settings("good"), GROUP_PATH, "2021-04-01")).isEmpty();

        replies.put("GET " + GROUP_PATH,
                new Reply(200, "{\"properties\":{\"provisioningState\":\"Succeeded\"}}"));
        Optional<JsonNode> group = client.getResource(settings("good"), GROUP_PATH, "2021-04-01");

        assertThat(group).isPresent();
        assertThat(AzureManagementClient.provisioningState(group.get())).isEqualTo("Succeeded");
    }

    @Test
    void putResource_created_sendsJsonAndReturnsResource() {
        replies.put("PUT " + GROUP_PATH, new Reply(201, "{\"name\":\"demo-c1\"}"));

        JsonNode created = client.putResource(settings("good"), GROUP_PATH, "2021-04-01",
                Map.of("location", "westeurope"));

        assertThat(created.path("name").asText()).isEqualTo("demo-c1");
        assertThat(lastRequest.get("body")).isEqualTo("{\"location\":\"westeurope\"}");
        assertThat(lastRequest.get("contentType")).isEqualTo("application/json");
    }

    @Test
    void putResource_emptyBody_isEmptyObject() {
        replies.put("PUT " + GROUP_PATH, new Reply(200, ""));

        JsonNode updated = client.putResource(settings("good"), GROUP_PATH, "2021-04-01", Map.of());

        assertThat(updated.isObject()).isTrue();
        assertThat(updated.size()).isZero();
    }

    @Test
    void putResource_conflict_carriesStatusAndBody() {
        replies.put("PUT " + GROUP_PATH, new Reply(409, "{\"error\":{\"code\":\"ResourceGroupBeingDeleted\"}}"));

        Throwable thrown = catchThrowable(() ->
                client.putResource(settings("good"), GROUP_PATH, "2021-04-01", Map.of()));

        assertThat(thrown).isInstanceOf(AzureApiException.class)
                .hasMessageContaining("PUT " + GROUP_PATH + " failed: HTTP 409")
                .hasMessageContaining("ResourceGroupBeingDeleted");
        assertThat(((AzureApiException) thrown).getStatusCode()).isEqualTo(409);
    }

    @Test
    void deleteResource_mapsStatuses() {
        replies.put("DELETE " + GROUP_PATH, new Reply(202, ""));
        assertThat(client.deleteResource(settings("good"), GROUP_PATH, "2021-04-01")).isTrue();

        replies.put("DELETE " + GROUP_PATH, new Reply(200, ""));
        assertThat(client.deleteResource(settings("good"), GROUP_PATH, "2021-04-01")).isTrue();

        replies.put("DELETE " + GROUP_PATH, new Reply(204, ""));
        assertThat(client.deleteResource(settings("good"), GROUP_PATH, "2021-04-01")).isFalse();

        replies.remove("DELETE " + GROUP_PATH);
        assertThat(client.deleteResource(settings("good"), GROUP_PATH, "2021-04-01")).isFalse();

        replies.put("DELETE " + GROUP_PATH, new Reply(500, "internal"));
        assertThatThrownBy(() -> client.deleteResource(settings("good"), GROUP_PATH, "2021-04-01"))
                .isInstanceOf(AzureApiException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void interruptedWorker_isCancelled() {
        client.accessToken(settings("good"));
        Thread.currentThread().interrupt();
        try {
            Throwable thrown = catchThrowable(() -> client.getResource(settings("good"), SLOW_PATH, "2021-04-01"));

            assertThat(thrown).isInstanceOf(StepException.class);
            assertThat(((StepException) thrown).getKind()).isEqualTo(StepException.Kind.CANCELLED);
            assertThat(thrown).hasMessageContaining("GET " + SLOW_PATH + " interrupted");
        } finally {
            Thread.interrupted();
        }
    }

    // ------------------------------------------------------------------
    // Fake endpoints
    // ------------------------------------------------------------------

    private void login(HttpExchange exchange) throws IOException {
        logins.incrementAndGet();
        String form = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        if (form.contains("client_secret=good") && form.contains("grant_type=client_credentials")) {
            reply(exchange, 200, "{\"access_token\":\"tok\",\"expires_in\":3600}");
        } else {
            reply(exchange, 401, "{\"error\":\"invalid_client\"}");
        }
    }

    private void resource(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        lastRequest.put("body", new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        lastRequest.put("query", String.valueOf(exchange.getRequestURI().getQuery()));
        lastRequest.put("authorization", String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
        lastRequest.put("contentType", String.valueOf(exchange.getRequestHeaders().getFirst("Content-Type")));
        if (SLOW_PATH.equals(path)) {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        Reply reply = replies.getOrDefault(exchange.getRequestMethod() + " " + path, new Reply(404, ""));
        reply(exchange, reply.status(), reply.body());
    }

    private static void reply(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
        exchange.close();
    }

    private static AzureSettings settings(String secret) {
        return new AzureSettings("tenant", "client", secret, "sub-1", "westeurope", null);
    }
}
