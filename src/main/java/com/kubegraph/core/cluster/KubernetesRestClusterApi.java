package com.kubegraph.core.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kubegraph.core.config.KubegraphProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ClusterApi} over the Kubernetes REST API using the JDK HTTP client and Jackson.
 *
 * <p>Authenticates with a bearer token from {@code kubegraph.cluster.token}, or from the
 * configured token file (the mounted service-account token when running in a pod). With
 * neither, requests go out unauthenticated, which suits a local {@code kubectl proxy}.
 */
public class KubernetesRestClusterApi implements ClusterApi {

    private static final Logger log = LoggerFactory.getLogger(KubernetesRestClusterApi.class);

    private final KubegraphProperties.Cluster properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String token;

    public KubernetesRestClusterApi(KubegraphProperties.Cluster properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build());
    }

    KubernetesRestClusterApi(KubegraphProperties.Cluster properties, ObjectMapper objectMapper, HttpClient httpClient) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.token = resolveToken(properties);
    }

    @Override
    public ObjectNode get(ResourceKey key) {
        return (ObjectNode) send("GET", KubernetesPaths.object(key), null);
    }

    @Override
    public ObjectNode create(ObjectNode manifest) {
        ResourceKey key = ResourceKey.of(manifest, properties.getNamespace());
        String path = KubernetesPaths.collection(key.apiVersion(), key.kind(), key.namespace());
        log.debug("Creating {}", key);
        return (ObjectNode) send("POST", path, manifest);
    }

    @Override
    public ObjectNode replace(ObjectNode manifest) {
        ResourceKey key = ResourceKey.of(manifest, properties.getNamespace());
        log.debug("Replacing {}", key);
        return (ObjectNode) send("PUT", KubernetesPaths.object(key), manifest);
    }

    @Override
    public void delete(ResourceKey key) {
        log.debug("Deleting {}", key);
        send("DELETE", KubernetesPaths.object(key), null);
    }

    @Override
    public List<ObjectNode> list(String apiVersion, String kind, String namespace) {
        JsonNode response = send("GET", KubernetesPaths.collection(apiVersion, kind, namespace), null);
        var items = new ArrayList<ObjectNode>();
        for (JsonNode item : response.path("items")) {
            if (item instanceof ObjectNode object) {
                items.add(object);
            }
        }
        return items;
    }

    @Override
    public String version() {
        JsonNode response = send("GET", "/version", null);
        return response.path("gitVersion").asText("unknown");
    }

    private JsonNode send(String method, String path, JsonNode body) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.getServer() + path))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("Accept", "application/json");
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body.toString()));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ClusterApiException(ClusterApiException.NETWORK_ERROR,
                    "Cluster API request failed: %s %s: %s".formatted(method, path, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterApiException(ClusterApiException.NETWORK_ERROR,
                    "Interrupted during cluster API request: " + method + " " + path, e);
        }

        if (response.statusCode() >= 400) {
            throw new ClusterApiException(response.statusCode(), "Cluster API %s %s failed (HTTP %d): %s"
                    .formatted(method, path, response.statusCode(), statusMessage(response.body())));
        }
        try {
            String responseBody = response.body();
            return responseBody == null || responseBody.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new ClusterApiException(response.statusCode(),
                    "Unparseable cluster API response for " + method + " " + path, e);
        }
    }

    /** Pulls {@code message} out of a Kubernetes Status body, falling back to the raw text. */
    private String statusMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode status = objectMapper.readTree(body);
            return status.path("message").asText(body);
        } catch (IOException e) {
            return body;
        }
    }

    private static String resolveToken(KubegraphProperties.Cluster properties) {
        if (properties.getToken() != null && !properties.getToken().isBlank()) {
            return properties.getToken();
        }
        String tokenFile = properties.getTokenFile();
        if (tokenFile != null && !tokenFile.isBlank() && Files.isReadable(Path.of(tokenFile))) {
            try {
                return Files.readString(Path.of(tokenFile), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.warn("Could not read cluster token from {}: {}", tokenFile, e.getMessage());
            }
        }
        return null;
    }
}
