package com.demo.introspection.autoconfigure;

import com.demo.introspection.client.IntrospectionClient;
import com.demo.introspection.client.RestClientIntrospectionClient;
import com.demo.introspection.decision.IntrospectionDecisionEngine;
import com.demo.introspection.filter.TokenIntrospectionFilter;
import com.demo.introspection.metrics.OutcomeMetrics;
import com.demo.introspection.properties.IntrospectionProps;
import com.demo.introspection.properties.IntrospectionSettings;
import com.demo.introspection.security.TokenExtractor;
import com.demo.introspection.store.CaffeineVerdictCache;
import com.demo.introspection.store.VerdictCache;
import com.demo.introspection.web.response.JsonResponseWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * 令牌内省自动配置。
 * <p>
 * 配置在启动时校验并固化为 {@link IntrospectionSettings}；业务可通过同类型 Bean 替换任意组件。
 */
@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "token-introspection", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(IntrospectionProps.class)
public class TokenIntrospectionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TokenIntrospectionAutoConfiguration.class);

    public static final String EXECUTOR_BEAN_NAME = "tokenIntrospectionExecutor";

    @Bean
    @ConditionalOnMissingBean
    public IntrospectionSettings introspectionSettings(IntrospectionProps props) {
        IntrospectionSettings settings = IntrospectionSettings.from(props);
        log.info("Token introspection enabled: {}", settings);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock introspectionClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenExtractor tokenExtractor(IntrospectionSettings settings) {
        return settings.extractionStrategy().create(settings.tokenHeader());
    }

    @Bean(name = EXECUTOR_BEAN_NAME)
    @ConditionalOnMissingBean(name = EXECUTOR_BEAN_NAME)
    public ThreadPoolTaskExecutor tokenIntrospectionExecutor(IntrospectionSettings settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.workerThreads());
        executor.setMaxPoolSize(settings.workerThreads());
        executor.setQueueCapacity(settings.workerQueueCapacity());
        executor.setThreadNamePrefix("introspection-");
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public IntrospectionClient introspectionClient(IntrospectionSettings settings,
                                                   ObjectProvider<RestClient.Builder> restClientBuilder,
                                                   ObjectProvider<ObjectMapper> objectMapper,
                                                   @Qualifier(EXECUTOR_BEAN_NAME) ThreadPoolTaskExecutor executor) {
        return RestClientIntrospectionClient.create(
                settings,
                restClientBuilder.getIfAvailable(RestClient::builder),
                objectMapper.getIfAvailable(ObjectMapper::new),
                executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public VerdictCache verdictCache(IntrospectionSettings settings, Clock clock) {
        return new CaffeineVerdictCache(settings.cacheMaxEntries(), settings.cacheDefaultTtl(), clock,
                Ticker.systemTicker());
    }

    @Bean
    @ConditionalOnMissingBean
    public IntrospectionDecisionEngine introspectionDecisionEngine(TokenExtractor tokenExtractor,
                                                                   VerdictCache verdictCache,
                                                                   IntrospectionClient introspectionClient,
                                                                   Clock clock) {
        return new IntrospectionDecisionEngine(tokenExtractor, verdictCache, introspectionClient, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonResponseWriter introspectionResponseWriter(ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonResponseWriter(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public OutcomeMetrics introspectionOutcomeMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry != null ? new OutcomeMetrics(registry) : OutcomeMetrics.noop();
    }

    @Bean
    @ConditionalOnMissingBean(name = "tokenIntrospectionFilterRegistration")
    public FilterRegistrationBean<TokenIntrospectionFilter> tokenIntrospectionFilterRegistration(
            IntrospectionDecisionEngine engine,
            JsonResponseWriter responseWriter,
            OutcomeMetrics metrics,
            IntrospectionSettings settings) {
        TokenIntrospectionFilter filter = new TokenIntrospectionFilter(
                engine, responseWriter, metrics, settings.realm(), settings.excludedPaths());
        FilterRegistrationBean<TokenIntrospectionFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setName("tokenIntrospectionFilter");
        registration.setOrder(settings.filterOrder());
        return registration;
    }
}
