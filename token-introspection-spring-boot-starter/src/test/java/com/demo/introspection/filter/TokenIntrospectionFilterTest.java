package com.demo.introspection.filter;

import com.demo.introspection.decision.IntrospectionDecisionEngine;
import com.demo.introspection.exception.IntrospectionError;
import com.demo.introspection.exception.IntrospectionException;
import com.demo.introspection.metrics.OutcomeMetrics;
import com.demo.introspection.model.IntrospectionVerdict;
import com.demo.introspection.security.BearerTokenExtractor;
import com.demo.introspection.security.IntrospectedTokenAuthentication;
import com.demo.introspection.store.CaffeineVerdictCache;
import com.demo.introspection.support.CountingIntrospectionClient;
import com.demo.introspection.support.MutableClock;
import com.demo.introspection.web.response.JsonResponseWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenIntrospectionFilterTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private CountingIntrospectionClient client =
            CountingIntrospectionClient.returning(new IntrospectionVerdict(true, NOW.plusSeconds(3600), null,
                    Map.of("sub", "user-1", "scope", "orders:read")));

    private TokenIntrospectionFilter filter(List<String> excludedPaths) {
        IntrospectionDecisionEngine engine = new IntrospectionDecisionEngine(new BearerTokenExtractor(),
                new CaffeineVerdictCache(100, Duration.ofSeconds(60), clock), client, clock);
        return new TokenIntrospectionFilter(engine, new JsonResponseWriter(new ObjectMapper()),
                new OutcomeMetrics(registry), "oauth2", excludedPaths);
    }

    private static MockHttpServletRequest request(String authorization) {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/orders");
        if (authorization != null) {
            req.addHeader("Authorization", authorization);
        }
        return req;
    }

    private double count(String outcome, String category) {
        return registry.counter(OutcomeMetrics.METER_NAME,
                OutcomeMetrics.TAG_OUTCOME, outcome, OutcomeMetrics.TAG_CATEGORY, category).count();
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void allowedRequestContinuesChainWithAuthentication() throws Exception {
        MockHttpServletRequest req = request("Bearer abc123");
        MockHttpServletResponse res = new MockHttpServletResponse();
        Authentication[] seen = new Authentication[1];
        FilterChain chain = (request, response) -> seen[0] = SecurityContextHolder.getContext().getAuthentication();

        filter(List.of()).doFilter(req, res, chain);

        assertThat(res.getStatus()).isEqualTo(200);
        assertThat(seen[0]).isInstanceOfSatisfying(IntrospectedTokenAuthentication.class, auth -> {
            assertThat(auth.getName()).isEqualTo("user-1");
            assertThat(auth.getAuthorities()).extracting(Object::toString).containsExactly("SCOPE_orders:read");
        });
        assertThat(count("allow", "allow")).isEqualTo(1.0);
    }

    @Test
    void missingTokenIsRejectedWith401AndChallenge() throws Exception {
        MockHttpServletResponse res = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter(List.of()).doFilter(request(null), res, chain);

        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(res.getHeader("WWW-Authenticate")).isEqualTo("Bearer realm=\"oauth2\"");
        assertThat(res.getContentAsString()).contains("\"code\":\"no_token\"");
        assertThat(chain.getRequest()).isNull();
        assertThat(client.calls()).isZero();
        assertThat(count("no_token", "security")).isEqualTo(1.0);
    }

    @Test
    void inactiveTokenIsRejectedWith401() throws Exception {
        client = CountingIntrospectionClient.returning(IntrospectionVerdict.inactive());
        MockHttpServletResponse res = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter(List.of()).doFilter(request("Bearer abc123"), res, chain);

        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(res.getContentAsString()).contains("inactive_token");
        assertThat(chain.getRequest()).isNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void introspectionOutageIsRejectedWith500() throws Exception {
        client = new CountingIntrospectionClient(token -> CompletableFuture.failedFuture(
                new IntrospectionException(new IntrospectionError.ClientError(new IOException("refused")))));
        MockHttpServletResponse res = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter(List.of()).doFilter(request("Bearer abc123"), res, chain);

        assertThat(res.getStatus()).isEqualTo(500);
        assertThat(res.getHeader("WWW-Authenticate")).isNull();
        assertThat(res.getContentAsString()).contains("client_error").doesNotContain("refused").doesNotContain("abc123");
        assertThat(chain.getRequest()).isNull();
        assertThat(count("client_error", "infrastructure")).isEqualTo(1.0);
    }

    @Test
    void excludedPathsBypassIntrospection() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse res = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter(List.of("/actuator/**")).doFilter(req, res, chain);

        assertThat(res.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isSameAs(req);
        assertThat(client.calls()).isZero();
    }

    @Test
    void authenticationDoesNotOutliveAllowedRequest() throws Exception {
        TokenIntrospectionFilter filter = filter(List.of("/public/**"));
        Authentication[] seen = new Authentication[2];

        filter.doFilter(request("Bearer abc123"), new MockHttpServletResponse(),
                (request, response) -> seen[0] = SecurityContextHolder.getContext().getAuthentication());
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();

        MockHttpServletRequest excluded = new MockHttpServletRequest("GET", "/public/x");
        filter.doFilter(excluded, new MockHttpServletResponse(),
                (request, response) -> seen[1] = SecurityContextHolder.getContext().getAuthentication());

        assertThat(seen[0]).isNotNull();
        assertThat(seen[0].getName()).isEqualTo("user-1");
        assertThat(seen[1]).isNull();
    }

    @Test
    void authenticationIsClearedWhenChainThrows() {
        FilterChain failing = (request, response) -> {
            throw new IllegalStateException("downstream failure");
        };

        assertThatThrownBy(() -> filter(List.of()).doFilter(request("Bearer abc123"), new MockHttpServletResponse(), failing))
                .isInstanceOf(IllegalStateException.class);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void interruptedWaitIsUnexpectedAndKeepsInterruptFlag() throws Exception {
        client = new CountingIntrospectionClient(token -> new CompletableFuture<>());
        MockHttpServletResponse res = new MockHttpServletResponse();

        Thread.currentThread().interrupt();
        try {
            filter(List.of()).doFilter(request("Bearer abc123"), res, new MockFilterChain());
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }

        assertThat(res.getStatus()).isEqualTo(500);
        assertThat(res.getContentAsString()).contains("unexpected");
    }
}
