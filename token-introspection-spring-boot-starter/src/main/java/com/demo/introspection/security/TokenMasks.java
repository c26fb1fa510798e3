package com.demo.introspection.security;

/**
 * 令牌属于敏感信息，日志中只输出前 4 位和长度。
 */
public final class TokenMasks {

    private static final int VISIBLE = 4;

    private TokenMasks() {
    }

    public static String mask(String token) {
        if (token == null) return "<none>";
        if (token.length() <= VISIBLE) {
            return "****(len=" + token.length() + ")";
        }
        return token.substring(0, VISIBLE) + "****(len=" + token.length() + ")";
    }
}
