package com.demo.introspection.filter;

import com.demo.introspection.decision.FilterOutcome;
import com.demo.introspection.decision.IntrospectionDecisionEngine;
import com.demo.introspection.exception.IntrospectionError;
import com.demo.introspection.metrics.OutcomeMetrics;
import com.demo.introspection.security.IntrospectedTokenAuthentication;
import com.demo.introspection.web.response.JsonResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 令牌内省过滤器
 * <p>
 * 功能：每个请求都必须携带有效令牌，由 {@link IntrospectionDecisionEngine} 给出放行/拒绝结果。
 * <p>
 * 放行：写入 SecurityContext 后继续过滤链，不修改请求本身；过滤链返回后清除 SecurityContext。
 * <p>
 * 拒绝：安全类原因返回 401 + WWW-Authenticate；内省服务故障返回 500。
 */
public class TokenIntrospectionFilter extends OncePerRequestFilter {

    private final IntrospectionDecisionEngine engine;
    private final JsonResponseWriter responseWriter;
    private final OutcomeMetrics metrics;
    private final String realm;
    private final List<String> excludedPaths;

    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final UrlPathHelper urlPathHelper = new UrlPathHelper();

    public TokenIntrospectionFilter(IntrospectionDecisionEngine engine,
                                    JsonResponseWriter responseWriter,
                                    OutcomeMetrics metrics,
                                    String realm,
                                    List<String> excludedPaths) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.responseWriter = Objects.requireNonNull(responseWriter, "responseWriter must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.realm = Objects.requireNonNull(realm, "realm must not be null");
        this.excludedPaths = excludedPaths == null ? List.of() : List.copyOf(excludedPaths);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (excludedPaths.isEmpty()) return false;
        String path = urlPathHelper.getPathWithinApplication(request);
        for (String pattern : excludedPaths) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        HttpHeaders headers = HttpHeaders.readOnlyHttpHeaders(new ServletServerHttpRequest(req).getHeaders());
        FilterOutcome outcome = await(engine.evaluate(headers));
        metrics.record(outcome);

        if (outcome instanceof FilterOutcome.Allow allow) {
            SecurityContextHolder.getContext().setAuthentication(IntrospectedTokenAuthentication.from(allow.verdict()));
            try {
                chain.doFilter(req, res);
            } finally {
                // 认证信息仅在本次请求内有效
                SecurityContextHolder.clearContext();
            }
            return;
        }

        SecurityContextHolder.clearContext();
        responseWriter.writeDenial(res, ((FilterOutcome.Deny) outcome).kind(), realm);
    }

    /**
     * 等待决策结果。当前线程被中断时放弃等待，共享的内省请求继续为其他请求服务。
     */
    private static FilterOutcome await(CompletableFuture<FilterOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FilterOutcome.deny(new IntrospectionError.Unexpected(e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return FilterOutcome.deny(new IntrospectionError.Unexpected(cause));
        }
    }
}
