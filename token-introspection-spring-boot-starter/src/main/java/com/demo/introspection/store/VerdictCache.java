package com.demo.introspection.store;

import com.demo.introspection.model.IntrospectionVerdict;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 内省结果缓存，key 为令牌。
 */
public interface VerdictCache {

    /**
     * 读取未过期的缓存结果；未命中时调用 loader 加载。
     *
     * <p>语义：
     * <ul>
     *   <li>同一令牌同一时刻最多只有一个 loader 在执行，并发请求共享同一次加载的结果</li>
     *   <li>成功结果的过期时间 = verdict 的 exp，缺省时为 now + 默认 TTL</li>
     *   <li>失败结果不缓存，下一次请求会重新加载</li>
     *   <li>每个调用方拿到独立的 future，取消它不会影响共享的加载</li>
     * </ul>
     */
    CompletableFuture<IntrospectionVerdict> getOrLoad(String token,
                                                      Function<String, CompletableFuture<IntrospectionVerdict>> loader);

    void invalidate(String token);

    void invalidateAll();

    long estimatedSize();
}
