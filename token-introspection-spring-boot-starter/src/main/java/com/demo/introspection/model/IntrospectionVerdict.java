package com.demo.introspection.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内省服务对某个令牌的判定结果（RFC 7662）。
 * <p>
 * 参数：
 * - active = 令牌是否有效
 * - expiry = exp，为 null 表示永不过期
 * - notBefore = nbf，为 null 表示无生效时间限制
 * - claims = 其余字段，原样保留，过滤器不做解释
 * <p>
 * 创建后不可变。
 */
public record IntrospectionVerdict(boolean active, Instant expiry, Instant notBefore, Map<String, Object> claims) {

    public static final String CLAIM_ACTIVE = "active";
    public static final String CLAIM_EXP = "exp";
    public static final String CLAIM_NBF = "nbf";
    public static final String CLAIM_SUB = "sub";
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_CLIENT_ID = "client_id";
    public static final String CLAIM_SCOPE = "scope";

    public IntrospectionVerdict {
        // claims 允许出现 JSON null，不能用 Map.copyOf
        claims = claims == null || claims.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    public static IntrospectionVerdict active(Instant expiry, Instant notBefore) {
        return new IntrospectionVerdict(true, expiry, notBefore, Map.of());
    }

    public static IntrospectionVerdict inactive() {
        return new IntrospectionVerdict(false, null, null, Map.of());
    }

    /**
     * 取字符串类型的附加字段，非字符串或空白时返回 null。
     */
    public String claimAsString(String name) {
        Object v = claims.get(name);
        if (v instanceof String s && !s.isBlank()) {
            return s;
        }
        return null;
    }
}
