package com.demo.introspection.web.response;

import com.demo.introspection.exception.DenyKind;

/**
 * 拒绝请求时的 JSON 响应体。
 */
public record ApiError(String code, String message) {

    public static ApiError of(DenyKind kind) {
        return new ApiError(kind.code(), kind.message());
    }
}
