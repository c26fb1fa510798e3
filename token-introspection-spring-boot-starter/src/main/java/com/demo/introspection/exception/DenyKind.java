package com.demo.introspection.exception;

/**
 * 拒绝原因分类。
 * <p>
 * infrastructure=true 表示过滤器自身或内省服务异常（需运维关注），
 * 否则是正常的安全拒绝（令牌缺失/失效）。
 */
public enum DenyKind {

    NO_TOKEN("no_token", false, "Missing bearer token"),
    INACTIVE_TOKEN("inactive_token", false, "Token is not active"),
    EXPIRED_TOKEN("expired_token", false, "Token has expired"),
    NOT_YET_ACTIVE("not_yet_active", false, "Token is not yet valid"),
    CLIENT_ERROR("client_error", true, "Introspection endpoint unreachable"),
    NON_PARSABLE_RESPONSE("non_parsable_response", true, "Introspection response could not be parsed"),
    UNEXPECTED("unexpected", true, "Unexpected error during token introspection");

    private final String code;
    private final boolean infrastructure;
    private final String message;

    DenyKind(String code, boolean infrastructure, String message) {
        this.code = code;
        this.infrastructure = infrastructure;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public boolean isInfrastructure() {
        return infrastructure;
    }

    /**
     * 对外可见的简短描述，不包含任何令牌或内部异常信息。
     */
    public String message() {
        return message;
    }
}
