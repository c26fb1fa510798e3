package com.demo.introspection.security;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * 直接把指定请求头的值作为令牌（如 X-Access-Token: xxx）。
 */
public class HeaderTokenExtractor implements TokenExtractor {

    private final String headerName;

    public HeaderTokenExtractor(String headerName) {
        this.headerName = Objects.requireNonNull(headerName, "headerName must not be null");
    }

    @Override
    public Optional<String> extract(HttpHeaders headers) {
        if (headers == null) return Optional.empty();
        String value = headers.getFirst(headerName);
        if (!StringUtils.hasText(value)) return Optional.empty();
        return Optional.of(value.trim());
    }

    public String getHeaderName() {
        return headerName;
    }
}
