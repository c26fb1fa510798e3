package com.demo.introspection.decision;

import com.demo.introspection.client.IntrospectionClient;
import com.demo.introspection.exception.DenyReason;
import com.demo.introspection.exception.IntrospectionError;
import com.demo.introspection.exception.IntrospectionException;
import com.demo.introspection.model.IntrospectionVerdict;
import com.demo.introspection.security.TokenExtractor;
import com.demo.introspection.security.TokenMasks;
import com.demo.introspection.store.VerdictCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 过滤决策
 * <p>
 * 流程（顺序固定）：
 * 1) 提取令牌：没有令牌直接拒绝，不访问网络
 * 2) 查缓存，未命中时调用内省服务
 * 3) active=false：拒绝
 * 4) exp 存在且 now > exp：拒绝
 * 5) nbf 存在且 now < nbf：拒绝
 * 6) 放行
 * <p>
 * 返回的 future 总是正常完成，任何异常都转换为 Deny，不会抛给宿主。
 */
public class IntrospectionDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(IntrospectionDecisionEngine.class);

    private final TokenExtractor tokenExtractor;
    private final VerdictCache verdictCache;
    private final IntrospectionClient introspectionClient;
    private final Clock clock;

    public IntrospectionDecisionEngine(TokenExtractor tokenExtractor,
                                       VerdictCache verdictCache,
                                       IntrospectionClient introspectionClient,
                                       Clock clock) {
        this.tokenExtractor = Objects.requireNonNull(tokenExtractor, "tokenExtractor must not be null");
        this.verdictCache = Objects.requireNonNull(verdictCache, "verdictCache must not be null");
        this.introspectionClient = Objects.requireNonNull(introspectionClient, "introspectionClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public CompletableFuture<FilterOutcome> evaluate(HttpHeaders headers) {
        // 1️⃣ 取token
        Optional<String> token;
        try {
            token = tokenExtractor.extract(headers);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(report(unexpected(e), null));
        }
        if (token.isEmpty()) {
            return CompletableFuture.completedFuture(report(FilterOutcome.deny(new DenyReason.NoToken()), null));
        }
        String value = token.get();

        // 2️⃣ 缓存 / 内省
        CompletableFuture<IntrospectionVerdict> verdict;
        try {
            verdict = verdictCache.getOrLoad(value, introspectionClient::introspect);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(report(unexpected(e), value));
        }

        // 3️⃣ 校验
        return verdict.handle((v, error) -> report(resolve(v, error), value));
    }

    private FilterOutcome resolve(IntrospectionVerdict verdict, Throwable error) {
        if (error != null) {
            return FilterOutcome.deny(reasonOf(error));
        }
        try {
            Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            return decide(verdict, now);
        } catch (RuntimeException e) {
            return unexpected(e);
        }
    }

    /**
     * 对已取得的内省结果做 active / exp / nbf 校验。exp、nbf 均为 epoch 秒，now 应按秒截断。
     */
    public static FilterOutcome decide(IntrospectionVerdict verdict, Instant now) {
        Objects.requireNonNull(verdict, "verdict must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (!verdict.active()) {
            return FilterOutcome.deny(new IntrospectionError.InactiveToken());
        }
        // exp 缺省视为永不过期
        if (verdict.expiry() != null && now.isAfter(verdict.expiry())) {
            return FilterOutcome.deny(new DenyReason.ExpiredToken(verdict.expiry()));
        }
        if (verdict.notBefore() != null && now.isBefore(verdict.notBefore())) {
            return FilterOutcome.deny(new DenyReason.NotYetActive(verdict.notBefore()));
        }
        return FilterOutcome.allow(verdict);
    }

    static DenyReason reasonOf(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof IntrospectionException ie) {
            return ie.getError();
        }
        return new IntrospectionError.Unexpected(cause);
    }

    private static FilterOutcome unexpected(Throwable e) {
        return FilterOutcome.deny(new IntrospectionError.Unexpected(e));
    }

    private static FilterOutcome report(FilterOutcome outcome, String token) {
        if (outcome instanceof FilterOutcome.Deny deny) {
            DenyReason reason = deny.reason();
            if (reason instanceof IntrospectionError.Unexpected u) {
                log.warn("Unexpected error occurred while processing token {}", TokenMasks.mask(token), u.cause());
            } else if (deny.kind().isInfrastructure()) {
                log.warn("Token introspection failed for token {}: {}", TokenMasks.mask(token), reason.detail());
            } else {
                log.debug("Denying token {}: {}", TokenMasks.mask(token), reason.detail());
            }
        } else if (log.isTraceEnabled()) {
            log.trace("Token {} accepted", TokenMasks.mask(token));
        }
        return outcome;
    }
}
