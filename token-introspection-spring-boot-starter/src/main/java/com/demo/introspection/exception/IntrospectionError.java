package com.demo.introspection.exception;

import java.util.Objects;

/**
 * 内省调用的失败结果。
 * <p>
 * 失败不会被缓存；除 {@link InactiveToken} 外均属于基础设施故障。
 */
public sealed interface IntrospectionError extends DenyReason
        permits IntrospectionError.InactiveToken, IntrospectionError.ClientError,
        IntrospectionError.NonParsableResponse, IntrospectionError.Unexpected {

    /**
     * 内省服务判定令牌无效（active=false 或返回非 200 状态码）。
     */
    record InactiveToken() implements IntrospectionError {
        @Override
        public DenyKind kind() {
            return DenyKind.INACTIVE_TOKEN;
        }

        @Override
        public String detail() {
            return "token is not active";
        }
    }

    /**
     * 网络/传输层失败（含超时）。
     */
    record ClientError(Throwable cause) implements IntrospectionError {
        public ClientError {
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public DenyKind kind() {
            return DenyKind.CLIENT_ERROR;
        }

        @Override
        public String detail() {
            return "error sending request to introspection endpoint: " + cause;
        }
    }

    /**
     * 响应体无法解析为内省结果。
     */
    record NonParsableResponse(String diagnostics, Throwable cause) implements IntrospectionError {
        public NonParsableResponse {
            Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        }

        public NonParsableResponse(String diagnostics) {
            this(diagnostics, null);
        }

        @Override
        public DenyKind kind() {
            return DenyKind.NON_PARSABLE_RESPONSE;
        }

        @Override
        public String detail() {
            return "error parsing introspection response: " + diagnostics;
        }
    }

    /**
     * 其他内部错误（理论上不应发生）。
     */
    record Unexpected(Throwable cause) implements IntrospectionError {
        public Unexpected {
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public DenyKind kind() {
            return DenyKind.UNEXPECTED;
        }

        @Override
        public String detail() {
            return "unexpected error: " + cause;
        }
    }
}
