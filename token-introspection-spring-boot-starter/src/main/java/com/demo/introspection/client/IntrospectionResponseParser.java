package com.demo.introspection.client;

import com.demo.introspection.exception.IntrospectionError;
import com.demo.introspection.exception.IntrospectionException;
import com.demo.introspection.model.IntrospectionVerdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 将内省响应体解析为 {@link IntrospectionVerdict}。
 * <p>
 * 规则：
 * - 响应必须是 JSON 对象，且 active 为布尔值
 * - exp / nbf 可缺省或为 null；存在时必须是非负整数（epoch 秒）
 * - 其他字段原样放入 claims，未知字段不算错误
 */
public class IntrospectionResponseParser {

    private final ObjectMapper objectMapper;

    public IntrospectionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public IntrospectionVerdict parse(byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? new byte[0] : body);
        } catch (JsonProcessingException e) {
            throw nonParsable(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw nonParsable(String.valueOf(e.getMessage()), e);
        }

        if (root == null || !root.isObject()) {
            throw nonParsable("introspection response is not a JSON object", null);
        }

        JsonNode active = root.get(IntrospectionVerdict.CLAIM_ACTIVE);
        if (active == null || !active.isBoolean()) {
            throw nonParsable("missing or non-boolean '" + IntrospectionVerdict.CLAIM_ACTIVE + "' member", null);
        }

        Instant exp = epochSeconds(root, IntrospectionVerdict.CLAIM_EXP);
        Instant nbf = epochSeconds(root, IntrospectionVerdict.CLAIM_NBF);

        return new IntrospectionVerdict(active.booleanValue(), exp, nbf, otherClaims(root));
    }

    private static Instant epochSeconds(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong() || node.longValue() < 0) {
            throw nonParsable("'" + name + "' is not an epoch timestamp in seconds: " + node, null);
        }
        try {
            return Instant.ofEpochSecond(node.longValue());
        } catch (DateTimeException e) {
            throw nonParsable("'" + name + "' is out of range: " + node, e);
        }
    }

    private Map<String, Object> otherClaims(JsonNode root) {
        Map<String, Object> claims = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            String name = field.getKey();
            if (IntrospectionVerdict.CLAIM_ACTIVE.equals(name)
                    || IntrospectionVerdict.CLAIM_EXP.equals(name)
                    || IntrospectionVerdict.CLAIM_NBF.equals(name)) {
                continue;
            }
            try {
                claims.put(name, objectMapper.treeToValue(field.getValue(), Object.class));
            } catch (JsonProcessingException e) {
                throw nonParsable("claim '" + name + "' could not be read: " + e.getOriginalMessage(), e);
            }
        }
        return claims;
    }

    private static IntrospectionException nonParsable(String diagnostics, Throwable cause) {
        return new IntrospectionException(new IntrospectionError.NonParsableResponse(diagnostics, cause));
    }
}
