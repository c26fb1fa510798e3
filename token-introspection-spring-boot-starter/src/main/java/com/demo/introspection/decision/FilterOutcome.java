package com.demo.introspection.decision;

import com.demo.introspection.exception.DenyKind;
import com.demo.introspection.exception.DenyReason;
import com.demo.introspection.model.IntrospectionVerdict;

import java.util.Objects;

/**
 * 单个请求的过滤结果：放行或拒绝（附原因）。
 */
public sealed interface FilterOutcome permits FilterOutcome.Allow, FilterOutcome.Deny {

    static FilterOutcome allow(IntrospectionVerdict verdict) {
        return new Allow(verdict);
    }

    static FilterOutcome deny(DenyReason reason) {
        return new Deny(reason);
    }

    boolean isAllowed();

    record Allow(IntrospectionVerdict verdict) implements FilterOutcome {
        public Allow {
            Objects.requireNonNull(verdict, "verdict must not be null");
        }

        @Override
        public boolean isAllowed() {
            return true;
        }
    }

    record Deny(DenyReason reason) implements FilterOutcome {
        public Deny {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public DenyKind kind() {
            return reason.kind();
        }

        @Override
        public boolean isAllowed() {
            return false;
        }
    }
}
