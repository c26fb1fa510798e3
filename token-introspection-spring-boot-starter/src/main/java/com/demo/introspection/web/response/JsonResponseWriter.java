package com.demo.introspection.web.response;

import com.demo.introspection.exception.DenyKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 将拒绝结果写入 HttpServletResponse（JSON 响应体）。
 * <p>
 * 安全类拒绝：401 + WWW-Authenticate: Bearer realm="..."；
 * 基础设施故障：500，不带认证质询。
 */
public class JsonResponseWriter {

    private final ObjectMapper objectMapper;

    public JsonResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public void writeDenial(HttpServletResponse response, DenyKind kind, String realm) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        if (kind.isInfrastructure()) {
            write(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, ApiError.of(kind));
            return;
        }
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"" + realm + "\"");
        write(response, HttpServletResponse.SC_UNAUTHORIZED, ApiError.of(kind));
    }

    public void write(HttpServletResponse response, int httpStatus, ApiError body) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(httpStatus);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");
        objectMapper.writeValue(response.getWriter(), body);
    }
}
