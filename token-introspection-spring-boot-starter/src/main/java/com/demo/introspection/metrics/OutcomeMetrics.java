package com.demo.introspection.metrics;

import com.demo.introspection.decision.FilterOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.util.Objects;

/**
 * 按结果记录计数：token.introspection.outcomes{outcome, category}。
 * <p>
 * category 区分 security（正常拒绝）与 infrastructure（内省服务故障），便于单独告警。
 */
public class OutcomeMetrics {

    public static final String METER_NAME = "token.introspection.outcomes";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_CATEGORY = "category";

    private final MeterRegistry registry;

    public OutcomeMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * 没有 MeterRegistry 时使用：空的 CompositeMeterRegistry 不会记录任何数据。
     */
    public static OutcomeMetrics noop() {
        return new OutcomeMetrics(new CompositeMeterRegistry());
    }

    public void record(FilterOutcome outcome) {
        String name;
        String category;
        if (outcome instanceof FilterOutcome.Deny deny) {
            name = deny.kind().code();
            category = deny.kind().isInfrastructure() ? "infrastructure" : "security";
        } else {
            name = "allow";
            category = "allow";
        }
        Counter.builder(METER_NAME)
                .description("Token introspection filter outcomes")
                .tag(TAG_OUTCOME, name)
                .tag(TAG_CATEGORY, category)
                .register(registry)
                .increment();
    }
}
