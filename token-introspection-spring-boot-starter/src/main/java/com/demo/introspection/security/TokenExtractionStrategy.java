package com.demo.introspection.security;

/**
 * 令牌提取策略（配置项 token-introspection.extraction-strategy）。
 */
public enum TokenExtractionStrategy {

    /**
     * Authorization: Bearer xxx
     */
    BEARER {
        @Override
        public TokenExtractor create(String headerName) {
            return new BearerTokenExtractor(headerName);
        }
    },

    /**
     * 指定请求头的原始值
     */
    HEADER {
        @Override
        public TokenExtractor create(String headerName) {
            return new HeaderTokenExtractor(headerName);
        }
    };

    public abstract TokenExtractor create(String headerName);
}
