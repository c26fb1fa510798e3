package com.demo.introspection.properties;

import com.demo.introspection.security.TokenExtractionStrategy;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * 校验并归一化后的不可变配置，启动时由 {@link IntrospectionProps} 构建一次，之后不再重新读取。
 *
 * @param authorization 发往内省端点的 Authorization 头，可为 null
 * @param tokenTypeHint 可为 null
 */
public record IntrospectionSettings(URI endpoint,
                                    String authorization,
                                    String tokenTypeHint,
                                    TokenExtractionStrategy extractionStrategy,
                                    String tokenHeader,
                                    long cacheMaxEntries,
                                    Duration cacheDefaultTtl,
                                    Duration connectTimeout,
                                    Duration readTimeout,
                                    int workerThreads,
                                    int workerQueueCapacity,
                                    String realm,
                                    List<String> excludedPaths,
                                    int filterOrder) {

    public IntrospectionSettings {
        excludedPaths = excludedPaths == null ? List.of() : List.copyOf(excludedPaths);
    }

    public static IntrospectionSettings from(IntrospectionProps props) {
        validate(props);

        List<String> excluded = new ArrayList<>();
        if (props.getExcludedPaths() != null) {
            for (String p : props.getExcludedPaths()) {
                if (StringUtils.hasText(p)) excluded.add(p.trim());
            }
        }

        return new IntrospectionSettings(
                URI.create(props.getEndpoint().trim()),
                resolveAuthorization(props),
                StringUtils.hasText(props.getTokenTypeHint()) ? props.getTokenTypeHint().trim() : null,
                props.getExtractionStrategy(),
                props.getTokenHeader().trim(),
                props.getCacheMaxEntries(),
                props.getCacheDefaultTtl(),
                props.getConnectTimeout(),
                props.getReadTimeout(),
                props.getWorkerThreads(),
                props.getWorkerQueueCapacity(),
                props.getRealm().trim(),
                excluded,
                props.getFilterOrder());
    }

    private static void validate(IntrospectionProps props) {
        if (!StringUtils.hasText(props.getEndpoint())) {
            throw new IllegalArgumentException("token-introspection.endpoint must not be blank");
        }
        URI uri;
        try {
            uri = URI.create(props.getEndpoint().trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("token-introspection.endpoint is not a valid URI", e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("token-introspection.endpoint must be an absolute http(s) URL");
        }
        if (!StringUtils.hasText(uri.getHost())) {
            throw new IllegalArgumentException("token-introspection.endpoint must contain a host");
        }
        if (StringUtils.hasText(props.getAuthorization()) && StringUtils.hasText(props.getClientId())) {
            throw new IllegalArgumentException("token-introspection: do not set both authorization and client-id");
        }
        if (StringUtils.hasText(props.getClientId()) && props.getClientSecret() == null) {
            throw new IllegalArgumentException("token-introspection.client-secret must be set when client-id is set");
        }
        if (props.getExtractionStrategy() == null) {
            throw new IllegalArgumentException("token-introspection.extraction-strategy must not be null");
        }
        if (!StringUtils.hasText(props.getTokenHeader())) {
            throw new IllegalArgumentException("token-introspection.token-header must not be blank");
        }
        if (props.getCacheMaxEntries() <= 0) {
            throw new IllegalArgumentException("token-introspection.cache-max-entries must be > 0");
        }
        requirePositive(props.getCacheDefaultTtl(), "token-introspection.cache-default-ttl");
        requirePositive(props.getConnectTimeout(), "token-introspection.connect-timeout");
        requirePositive(props.getReadTimeout(), "token-introspection.read-timeout");
        if (props.getWorkerThreads() <= 0) {
            throw new IllegalArgumentException("token-introspection.worker-threads must be > 0");
        }
        if (props.getWorkerQueueCapacity() < 0) {
            throw new IllegalArgumentException("token-introspection.worker-queue-capacity must be >= 0");
        }
        if (!StringUtils.hasText(props.getRealm()) || props.getRealm().contains("\"")) {
            throw new IllegalArgumentException("token-introspection.realm must be non-blank and must not contain quotes");
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    private static String resolveAuthorization(IntrospectionProps props) {
        if (StringUtils.hasText(props.getAuthorization())) {
            return props.getAuthorization().trim();
        }
        if (StringUtils.hasText(props.getClientId())) {
            String credentials = props.getClientId().trim() + ":" + props.getClientSecret();
            return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        }
        return null;
    }

    /**
     * 不输出凭据。
     */
    @Override
    public String toString() {
        return "IntrospectionSettings[endpoint=" + endpoint
                + ", authorization=" + (authorization == null ? "none" : "****")
                + ", extractionStrategy=" + extractionStrategy
                + ", tokenHeader=" + tokenHeader
                + ", cacheMaxEntries=" + cacheMaxEntries
                + ", cacheDefaultTtl=" + cacheDefaultTtl + "]";
    }
}
