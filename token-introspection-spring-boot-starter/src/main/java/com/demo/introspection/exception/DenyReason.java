package com.demo.introspection.exception;

import java.time.Instant;
import java.util.Objects;

/**
 * 请求被拒绝的原因（封闭类型，每种拒绝一个 record）。
 * <p>
 * 内省调用可能产生的失败单独归入 {@link IntrospectionError}。
 */
public sealed interface DenyReason
        permits DenyReason.NoToken, DenyReason.ExpiredToken, DenyReason.NotYetActive, IntrospectionError {

    DenyKind kind();

    /**
     * 用于日志的诊断信息（不含令牌）。
     */
    String detail();

    /**
     * 请求中未携带令牌，或令牌格式不符合提取策略。
     */
    record NoToken() implements DenyReason {
        @Override
        public DenyKind kind() {
            return DenyKind.NO_TOKEN;
        }

        @Override
        public String detail() {
            return "no token present";
        }
    }

    /**
     * 当前时间已超过 exp。
     */
    record ExpiredToken(Instant expiry) implements DenyReason {
        public ExpiredToken {
            Objects.requireNonNull(expiry, "expiry must not be null");
        }

        @Override
        public DenyKind kind() {
            return DenyKind.EXPIRED_TOKEN;
        }

        @Override
        public String detail() {
            return "token expired at " + expiry;
        }
    }

    /**
     * 当前时间早于 nbf。
     */
    record NotYetActive(Instant notBefore) implements DenyReason {
        public NotYetActive {
            Objects.requireNonNull(notBefore, "notBefore must not be null");
        }

        @Override
        public DenyKind kind() {
            return DenyKind.NOT_YET_ACTIVE;
        }

        @Override
        public String detail() {
            return "token not valid before " + notBefore;
        }
    }
}
