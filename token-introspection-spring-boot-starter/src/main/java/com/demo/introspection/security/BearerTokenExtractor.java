package com.demo.introspection.security;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * 从 "Authorization: Bearer xxx" 形式的请求头提取令牌。
 * <ul>
 *   <li>兼容大小写：bearer/Bearer</li>
 *   <li>兼容多空格：Bearer    xxx</li>
 *   <li>兼容 Bearer:xxx（少数网关的写法）</li>
 * </ul>
 */
public class BearerTokenExtractor implements TokenExtractor {

    private static final String PREFIX = "Bearer";

    private final String headerName;

    public BearerTokenExtractor() {
        this(HttpHeaders.AUTHORIZATION);
    }

    public BearerTokenExtractor(String headerName) {
        this.headerName = Objects.requireNonNull(headerName, "headerName must not be null");
    }

    @Override
    public Optional<String> extract(HttpHeaders headers) {
        if (headers == null) return Optional.empty();
        return Optional.ofNullable(extractBearerToken(headers.getFirst(headerName)));
    }

    static String extractBearerToken(String headerValue) {
        if (!StringUtils.hasText(headerValue)) return null;

        String h = headerValue.trim();
        if (!h.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return null;
        }

        String rest = h.substring(PREFIX.length());
        // "BearerXyz" 不是合法的 scheme
        if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0)) && rest.charAt(0) != ':') {
            return null;
        }
        rest = rest.trim();
        if (rest.startsWith(":")) {
            rest = rest.substring(1).trim();
        }
        return rest.isEmpty() ? null : rest;
    }

    public String getHeaderName() {
        return headerName;
    }
}
