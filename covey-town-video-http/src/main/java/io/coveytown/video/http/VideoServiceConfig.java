package io.coveytown.video.http;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for the video token service.
 *
 * <p>Build explicitly:
 * <pre>{@code
 * VideoServiceConfig config = VideoServiceConfig.builder(URI.create("https://video.example.com/token"))
 *     .apiKey(secret)
 *     .requestTimeout(Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 * or from the environment with {@link #fromEnvironment()}.
 */
public final class VideoServiceConfig {

    public static final String ENV_ENDPOINT = "VIDEO_TOKEN_ENDPOINT";
    public static final String ENV_API_KEY = "VIDEO_API_KEY";
    public static final String ENV_TOKEN_TTL_SECONDS = "VIDEO_TOKEN_TTL_SECONDS";

    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(1);

    private final URI endpoint;
    private final String apiKey;
    private final Duration requestTimeout;
    private final Duration tokenTtl;

    private VideoServiceConfig(Builder builder) {
        this.endpoint = Objects.requireNonNull(builder.endpoint, "endpoint");
        this.apiKey = builder.apiKey;
        this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        this.tokenTtl = builder.tokenTtl != null ? builder.tokenTtl : DEFAULT_TOKEN_TTL;
    }

    /**
     * @param endpoint absolute {@code http} or {@code https} URL of the token service
     * @throws IllegalArgumentException if the endpoint is not an absolute http(s) URL
     */
    public static Builder builder(URI endpoint) {
        return new Builder(endpoint);
    }

    /**
     * Reads {@value #ENV_ENDPOINT} (required), {@value #ENV_API_KEY} and
     * {@value #ENV_TOKEN_TTL_SECONDS} from the process environment.
     *
     * @throws IllegalStateException if the endpoint is missing or a value is malformed
     */
    public static VideoServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static VideoServiceConfig fromEnvironment(Map<String, String> env) {
        String endpoint = env.get(ENV_ENDPOINT);
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException(ENV_ENDPOINT + " must be set");
        }
        Builder builder;
        try {
            builder = builder(URI.create(endpoint.trim()));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(ENV_ENDPOINT + " is not a valid endpoint: " + endpoint, e);
        }
        builder.apiKey(env.get(ENV_API_KEY));
        String ttl = env.get(ENV_TOKEN_TTL_SECONDS);
        if (ttl != null && !ttl.isBlank()) {
            try {
                builder.tokenTtl(Duration.ofSeconds(Long.parseLong(ttl.trim())));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(ENV_TOKEN_TTL_SECONDS + " must be a positive number of seconds: " + ttl, e);
            }
        }
        return builder.build();
    }

    public URI endpoint() {
        return endpoint;
    }

    /**
     * Bearer key sent with every request, or null when the service needs none.
     */
    public String apiKey() {
        return apiKey;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    /**
     * Lifetime requested for issued tokens.
     */
    public Duration tokenTtl() {
        return tokenTtl;
    }

    public static final class Builder {
        private final URI endpoint;
        private String apiKey;
        private Duration requestTimeout;
        private Duration tokenTtl;

        private Builder(URI endpoint) {
            this.endpoint = httpUrl(endpoint);
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = positive(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder tokenTtl(Duration tokenTtl) {
            this.tokenTtl = positive(tokenTtl, "tokenTtl");
            return this;
        }

        public VideoServiceConfig build() {
            return new VideoServiceConfig(this);
        }

        private static URI httpUrl(URI endpoint) {
            Objects.requireNonNull(endpoint, "endpoint");
            String scheme = endpoint.getScheme();
            if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || endpoint.getHost() == null) {
                throw new IllegalArgumentException("endpoint must be an absolute http(s) URL: " + endpoint);
            }
            return endpoint;
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
