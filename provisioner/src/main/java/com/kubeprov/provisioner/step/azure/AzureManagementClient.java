package com.kubeprov.provisioner.step.azure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubeprov.provisioner.step.AzureSettings;
import com.kubeprov.provisioner.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Minimal Azure Resource Manager client: service-principal login plus
 * PUT / GET / DELETE of resources by their ARM path.
 *
 * Tokens are cached per service principal credential (tenant, client id and
 * a digest of the secret) until shortly before they expire, so a request with
 * a different secret always goes back to the login endpoint. Called from run
 * workers, so blocking I/O is fine here.
 */
@Component
public class AzureManagementClient {

    private static final Logger log = LoggerFactory.getLogger(AzureManagementClient.class);

    static final String MANAGEMENT_SCOPE = "https://management.azure.com/.default";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofMinutes(2);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       managementUrl;
    private final String       loginUrl;
    private final Duration     pollInterval;

    private final Map<String, CachedToken> tokens = new ConcurrentHashMap<>();

    public AzureManagementClient(
            @Value("${kubeprov.azure.management-url:https://management.azure.com}") String managementUrl,
            @Value("${kubeprov.azure.login-url:https://login.microsoftonline.com}") String loginUrl,
            @Value("${kubeprov.azure.poll-interval:PT5S}") Duration pollInterval,
            ObjectMapper objectMapper) {
        this.managementUrl = stripTrailingSlash(managementUrl);
        this.loginUrl      = stripTrailingSlash(loginUrl);
        this.pollInterval  = pollInterval;
        this.json          = objectMapper;
        this.http          = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** How long steps wait between polls of a long-running ARM operation. */
    public Duration pollInterval() { return pollInterval; }

    // ------------------------------------------------------------------
    // Authentication
    // ------------------------------------------------------------------

    /**
     * Bearer token for the management API, via the OAuth2 client-credentials grant.
     *
     * @throws StepException CONFIGURATION when the service principal settings are incomplete
     */
    public String accessToken(AzureSettings azure) {
        requireSetting(azure.tenantId(), "tenantId");
        requireSetting(azure.clientId(), "clientId");
        requireSetting(azure.clientSecret(), "clientSecret");

        String cacheKey = cacheKey(azure);
        CachedToken cached = tokens.get(cacheKey);
        if (cached != null && Instant.now().isBefore(cached.expiresAt())) {
            return cached.value();
        }

        log.debug("Requesting Azure token for client {} in tenant {}", azure.clientId(), azure.tenantId());
        String form = Map.of(
                        "grant_type",    "client_credentials",
                        "client_id",     azure.clientId(),
                        "client_secret", azure.clientSecret(),
                        "scope",         MANAGEMENT_SCOPE)
                .entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(loginUrl + "/" + azure.tenantId() + "/oauth2/v2.0/token"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        HttpResponse<String> resp = send(req, "login");
        if (resp.statusCode() != 200) {
            throw new AzureApiException("login failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                    resp.statusCode());
        }
        JsonNode body = parse(resp.body(), "login");
        String token = body.path("access_token").asText(null);
        if (token == null) {
            throw new AzureApiException("login response carried no access_token", resp.statusCode());
        }
        long expiresIn = body.path("expires_in").asLong(3600);
        tokens.put(cacheKey, new CachedToken(token,
                Instant.now().plusSeconds(expiresIn).minus(TOKEN_EXPIRY_MARGIN)));
        return token;
    }

    // ------------------------------------------------------------------
    // Resources
    // ------------------------------------------------------------------

    /** Create or update a resource; returns the resource as ARM reports it. */
    public JsonNode putResource(AzureSettings azure, String path, String apiVersion, Object body) {
        String op = "PUT " + path;
        log.info("Azure {}", op);
        HttpRequest req = request(azure, path, apiVersion)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();
        HttpResponse<String> resp = send(req, op);
        if (resp.statusCode() != 200 && resp.statusCode() != 201) {
            throw failure(op, resp);
        }
        return parse(resp.body(), op);
    }

    /** The resource at {@code path}, or empty when it does not exist. */
    public Optional<JsonNode> getResource(AzureSettings azure, String path, String apiVersion) {
        String op = "GET " + path;
        HttpResponse<String> resp = send(request(azure, path, apiVersion).GET().build(), op);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (resp.statusCode() != 200) {
            throw failure(op, resp);
        }
        return Optional.of(parse(resp.body(), op));
    }

    /**
     * Start deleting a resource. A resource that is already gone is not an error.
     *
     * @return true if ARM accepted a deletion, false if there was nothing to delete
     */
    public boolean deleteResource(AzureSettings azure, String path, String apiVersion) {
        String op = "DELETE " + path;
        log.info("Azure {}", op);
        HttpResponse<String> resp = send(request(azure, path, apiVersion).DELETE().build(), op);
        int status = resp.statusCode();
        if (status == 404 || status == 204) {
            return false;
        }
        if (status != 200 && status != 202) {
            throw failure(op, resp);
        }
        return true;
    }

    /** {@code properties.provisioningState} of an ARM resource, or null if absent. */
    public static String provisioningState(JsonNode resource) {
        JsonNode state = resource.path("properties").path("provisioningState");
        return state.isMissingNode() || state.isNull() ? null : state.asText();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder request(AzureSettings azure, String path, String apiVersion) {
        return HttpRequest.newBuilder()
                .uri(URI.create(managementUrl + path + "?api-version=" + apiVersion))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Bearer " + accessToken(azure))
                .header("Accept", "application/json");
    }

    private HttpResponse<String> send(HttpRequest req, String op) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepException(StepException.Kind.CANCELLED, op + " interrupted", e);
        } catch (Exception e) {
            throw new AzureApiException(op + " failed", e);
        }
    }

    private static AzureApiException failure(String op, HttpResponse<String> resp) {
        return new AzureApiException(op + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                resp.statusCode());
    }

    private JsonNode parse(String body, String op) {
        try {
            return json.readTree(body == null || body.isEmpty() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new AzureApiException("Failed to parse " + op + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AzureApiException("JSON serialization failed", e);
        }
    }

    private static void requireSetting(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new StepException(StepException.Kind.CONFIGURATION, "azure: " + name + " is required");
        }
    }

    // The secret only enters the key as a digest.
    static String cacheKey(AzureSettings azure) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(azure.clientSecret().getBytes(StandardCharsets.UTF_8));
            return azure.tenantId() + "/" + azure.clientId() + "/" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record CachedToken(String value, Instant expiresAt) {}
}
