package io.coveytown.video.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.coveytown.server.spi.VideoProvisioningException;
import io.coveytown.server.spi.VideoTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Objects;

/**
 * {@link VideoTokenProvider} that asks a remote token service over HTTP.
 *
 * <p>Sends {@code POST <endpoint>} with a JSON body
 * {@code {"townId": ..., "identity": ..., "ttlSeconds": ...}} and expects a 2xx response whose
 * JSON body carries a non-empty {@code "token"} field. Any other outcome is reported as a
 * {@link VideoProvisioningException}. Thread-safe.
 */
public final class HttpVideoTokenProvider implements VideoTokenProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpVideoTokenProvider.class);

    private final VideoServiceConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public HttpVideoTokenProvider(VideoServiceConfig config, HttpClient httpClient, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Creates a provider with a default {@link HttpClient} and {@link ObjectMapper}.
     */
    public static HttpVideoTokenProvider create(VideoServiceConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .build();
        return new HttpVideoTokenProvider(config, client, new ObjectMapper());
    }

    @Override
    public String getTokenForTown(String townId, String playerId) throws VideoProvisioningException {
        Objects.requireNonNull(townId, "townId");
        Objects.requireNonNull(playerId, "playerId");

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(buildRequest(townId, playerId), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new VideoProvisioningException("Video token request timed out after " + config.requestTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VideoProvisioningException("Video token request interrupted", e);
        } catch (IOException e) {
            throw new VideoProvisioningException("Video token request failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOGGER.warn("Video token service answered {} for town {}", status, townId);
            throw new VideoProvisioningException("Video token service returned HTTP " + status);
        }
        return readToken(response.body());
    }

    private HttpRequest buildRequest(String townId, String playerId) throws VideoProvisioningException {
        ObjectNode body = mapper.createObjectNode()
                .put("townId", townId)
                .put("identity", playerId)
                .put("ttlSeconds", config.tokenTtl().getSeconds());
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (IOException e) {
            throw new VideoProvisioningException("Failed to encode video token request", e);
        }

        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(config.endpoint())
                    .timeout(config.requestTimeout())
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(bytes));
            if (config.apiKey() != null) {
                builder.header("Authorization", "Bearer " + config.apiKey());
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new VideoProvisioningException("Invalid video token request: " + e.getMessage(), e);
        }
    }

    private String readToken(byte[] body) throws VideoProvisioningException {
        if (body == null || body.length == 0) {
            throw new VideoProvisioningException("Video token service returned an empty body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new VideoProvisioningException("Video token service returned malformed JSON", e);
        }
        JsonNode token = root == null ? null : root.get("token");
        if (token == null || !token.isTextual() || token.asText().isEmpty()) {
            throw new VideoProvisioningException("Video token service response has no token");
        }
        return token.asText();
    }
}
