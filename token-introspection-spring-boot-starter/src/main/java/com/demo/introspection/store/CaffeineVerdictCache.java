package com.demo.introspection.store;

import com.demo.introspection.model.IntrospectionVerdict;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 基于 Caffeine {@link AsyncCache} 的 {@link VerdictCache} 实现。
 * <p>
 * Caffeine 按 key 合并计算：加载中的 future 作为条目本身存放，所有并发调用方共享；
 * 异常完成的 future 会被自动移除，因此失败不会被缓存。
 * <p>
 * 过期时间按条目计算（exp 或默认 TTL）。条目剩余时长由 Clock 算出，流逝时间由 Ticker 计量；
 * 生产环境应传入单调的 {@link Ticker#systemTicker()}，三参构造器由 Clock 推导 Ticker，供测试控制时间。
 */
public class CaffeineVerdictCache implements VerdictCache {

    /**
     * exp 很远的条目最多缓存这么久。
     */
    static final Duration MAX_ENTRY_LIFETIME = Duration.ofDays(3650);

    private final AsyncCache<String, IntrospectionVerdict> cache;
    private final Clock clock;
    private final Duration defaultTtl;

    public CaffeineVerdictCache(long maxEntries, Duration defaultTtl, Clock clock) {
        this(maxEntries, defaultTtl, clock, clockTicker(clock));
    }

    public CaffeineVerdictCache(long maxEntries, Duration defaultTtl, Clock clock, Ticker ticker) {
        Objects.requireNonNull(ticker, "ticker must not be null");
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be > 0");
        }

        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new VerdictExpiry())
                .ticker(ticker)
                // 维护任务在调用线程执行，完成回调与过期判断同步可见
                .executor(Runnable::run)
                .buildAsync();
    }

    @Override
    public CompletableFuture<IntrospectionVerdict> getOrLoad(String token,
                                                             Function<String, CompletableFuture<IntrospectionVerdict>> loader) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(loader, "loader must not be null");

        boolean[] loaded = new boolean[1];
        CompletableFuture<IntrospectionVerdict> shared = cache.get(token, (key, executor) -> {
            loaded[0] = true;
            return load(key, loader);
        });
        if (!loaded[0] && shared.isCompletedExceptionally()) {
            // 失败的 future 在通知完等待方之后才被 Caffeine 移除，期间的重试不能拿到它
            cache.asMap().remove(token, shared);
            shared = cache.get(token, (key, executor) -> load(key, loader));
        }
        return shared.copy();
    }

    @Override
    public void invalidate(String token) {
        cache.synchronous().invalidate(token);
    }

    @Override
    public void invalidateAll() {
        cache.synchronous().invalidateAll();
    }

    @Override
    public long estimatedSize() {
        cache.synchronous().cleanUp();
        return cache.synchronous().estimatedSize();
    }

    private static Ticker clockTicker(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        Instant origin = clock.instant();
        return () -> Duration.between(origin, clock.instant()).toNanos();
    }

    private static CompletableFuture<IntrospectionVerdict> load(String token,
                                                                Function<String, CompletableFuture<IntrospectionVerdict>> loader) {
        try {
            CompletableFuture<IntrospectionVerdict> future = loader.apply(token);
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("loader returned null"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * 条目存活时长 = 距 exp 的剩余时间，exp 缺省时用默认 TTL；已过期则为 0。
     */
    long nanosToLive(IntrospectionVerdict verdict) {
        Instant now = clock.instant();
        Instant deadline = verdict.expiry() != null ? verdict.expiry() : now.plus(defaultTtl);
        Duration ttl = Duration.between(now, deadline);
        if (ttl.isNegative()) {
            return 0L;
        }
        if (ttl.compareTo(MAX_ENTRY_LIFETIME) > 0) {
            ttl = MAX_ENTRY_LIFETIME;
        }
        return ttl.toNanos();
    }

    private final class VerdictExpiry implements Expiry<String, IntrospectionVerdict> {

        @Override
        public long expireAfterCreate(String key, IntrospectionVerdict value, long currentTime) {
            return nanosToLive(value);
        }

        @Override
        public long expireAfterUpdate(String key, IntrospectionVerdict value, long currentTime, long currentDuration) {
            return nanosToLive(value);
        }

        @Override
        public long expireAfterRead(String key, IntrospectionVerdict value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
