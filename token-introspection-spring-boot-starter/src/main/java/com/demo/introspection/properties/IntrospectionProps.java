package com.demo.introspection.properties;

import com.demo.introspection.security.TokenExtractionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 令牌内省配置属性
 */
@ConfigurationProperties(prefix = "token-introspection")
public class IntrospectionProps {

    /**
     * 是否注册内省过滤器。
     */
    private boolean enabled = true;

    /**
     * 内省端点地址（必填），如 https://auth.example.com/oauth2/introspect。
     */
    private String endpoint;

    /**
     * 调用内省端点时使用的 Authorization 头（原样发送）。
     *
     * <p>与 clientId/clientSecret 二选一。</p>
     */
    private String authorization;

    /**
     * 客户端 ID，配合 clientSecret 生成 HTTP Basic 认证头。
     */
    private String clientId;

    /**
     * 客户端密钥。建议通过环境变量/配置中心注入，避免明文提交到仓库。
     */
    private String clientSecret;

    /**
     * 可选的 token_type_hint，如 access_token。
     */
    private String tokenTypeHint;

    /**
     * 令牌提取策略。
     */
    private TokenExtractionStrategy extractionStrategy = TokenExtractionStrategy.BEARER;

    /**
     * 提取令牌的请求头。
     */
    private String tokenHeader = "Authorization";

    /**
     * 缓存最大条目数。
     */
    private long cacheMaxEntries = 1000;

    /**
     * 内省结果没有 exp 时的缓存时长。
     */
    private Duration cacheDefaultTtl = Duration.ofSeconds(60);

    /**
     * 连接超时。
     */
    private Duration connectTimeout = Duration.ofSeconds(2);

    /**
     * 读取超时。
     */
    private Duration readTimeout = Duration.ofSeconds(5);

    /**
     * 执行内省请求的线程数。
     */
    private int workerThreads = 8;

    /**
     * 等待执行的内省请求队列容量，队列满时请求按 unexpected 拒绝。
     */
    private int workerQueueCapacity = 100;

    /**
     * 401 响应中 WWW-Authenticate 的 realm。
     */
    private String realm = "oauth2";

    /**
     * 不做内省校验的路径（Ant 风格），如 /actuator/health。
     */
    private List<String> excludedPaths = new ArrayList<>();

    /**
     * 过滤器顺序。
     */
    private int filterOrder = -100;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getAuthorization() {
        return authorization;
    }

    public void setAuthorization(String authorization) {
        this.authorization = authorization;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public String getTokenTypeHint() {
        return tokenTypeHint;
    }

    public void setTokenTypeHint(String tokenTypeHint) {
        this.tokenTypeHint = tokenTypeHint;
    }

    public TokenExtractionStrategy getExtractionStrategy() {
        return extractionStrategy;
    }

    public void setExtractionStrategy(TokenExtractionStrategy extractionStrategy) {
        this.extractionStrategy = extractionStrategy;
    }

    public String getTokenHeader() {
        return tokenHeader;
    }

    public void setTokenHeader(String tokenHeader) {
        this.tokenHeader = tokenHeader;
    }

    public long getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(long cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public Duration getCacheDefaultTtl() {
        return cacheDefaultTtl;
    }

    public void setCacheDefaultTtl(Duration cacheDefaultTtl) {
        this.cacheDefaultTtl = cacheDefaultTtl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getWorkerQueueCapacity() {
        return workerQueueCapacity;
    }

    public void setWorkerQueueCapacity(int workerQueueCapacity) {
        this.workerQueueCapacity = workerQueueCapacity;
    }

    public String getRealm() {
        return realm;
    }

    public void setRealm(String realm) {
        this.realm = realm;
    }

    public List<String> getExcludedPaths() {
        return excludedPaths;
    }

    public void setExcludedPaths(List<String> excludedPaths) {
        this.excludedPaths = excludedPaths;
    }

    public int getFilterOrder() {
        return filterOrder;
    }

    public void setFilterOrder(int filterOrder) {
        this.filterOrder = filterOrder;
    }
}
