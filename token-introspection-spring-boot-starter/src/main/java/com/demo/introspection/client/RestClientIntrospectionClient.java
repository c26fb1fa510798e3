package com.demo.introspection.client;

import com.demo.introspection.exception.IntrospectionError;
import com.demo.introspection.exception.IntrospectionException;
import com.demo.introspection.model.IntrospectionVerdict;
import com.demo.introspection.properties.IntrospectionSettings;
import com.demo.introspection.security.TokenMasks;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.http.HttpClient;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 基于 Spring {@link RestClient} 的内省客户端。
 * <p>
 * 请求：POST endpoint，application/x-www-form-urlencoded，body 为 token=xxx（可选 token_type_hint）。
 * <p>
 * 阻塞的 HTTP 调用在独立的线程池中执行，慢请求不会占用其他请求的处理线程。
 * 超时由底层 HTTP 客户端负责，超时与网络错误一样归为 ClientError。
 */
public class RestClientIntrospectionClient implements IntrospectionClient {

    private static final Logger log = LoggerFactory.getLogger(RestClientIntrospectionClient.class);

    static final String PARAM_TOKEN = "token";
    static final String PARAM_TOKEN_TYPE_HINT = "token_type_hint";

    private final RestClient restClient;
    private final IntrospectionSettings settings;
    private final IntrospectionResponseParser parser;
    private final Executor executor;

    public RestClientIntrospectionClient(RestClient restClient,
                                         IntrospectionSettings settings,
                                         IntrospectionResponseParser parser,
                                         Executor executor) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * 按配置的超时创建底层 JDK HttpClient。
     */
    public static RestClientIntrospectionClient create(IntrospectionSettings settings,
                                                       RestClient.Builder builder,
                                                       ObjectMapper objectMapper,
                                                       Executor executor) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(settings.readTimeout());

        RestClient restClient = builder.requestFactory(requestFactory).build();
        return new RestClientIntrospectionClient(restClient, settings, new IntrospectionResponseParser(objectMapper), executor);
    }

    @Override
    public CompletableFuture<IntrospectionVerdict> introspect(String token) {
        try {
            return CompletableFuture.supplyAsync(() -> call(token), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IntrospectionException(new IntrospectionError.Unexpected(e)));
        }
    }

    IntrospectionVerdict call(String token) {
        log.debug("Introspecting token {} at {}", TokenMasks.mask(token), settings.endpoint());

        RawResponse response;
        try {
            response = restClient.post()
                    .uri(settings.endpoint())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(this::applyAuthorization)
                    .body(formBody(token))
                    .exchange((request, res) ->
                            new RawResponse(res.getStatusCode().value(), StreamUtils.copyToByteArray(res.getBody())));
        } catch (ResourceAccessException e) {
            throw new IntrospectionException(new IntrospectionError.ClientError(e));
        } catch (RestClientException e) {
            // 请求体写出失败等，属于程序缺陷
            throw new IntrospectionException(new IntrospectionError.Unexpected(e));
        }

        if (response.status() != HttpStatus.OK.value()) {
            log.debug("Introspection endpoint answered {} for token {}", response.status(), TokenMasks.mask(token));
            throw new IntrospectionException(new IntrospectionError.InactiveToken());
        }
        return parser.parse(response.body());
    }

    private MultiValueMap<String, String> formBody(String token) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add(PARAM_TOKEN, token);
        if (settings.tokenTypeHint() != null) {
            form.add(PARAM_TOKEN_TYPE_HINT, settings.tokenTypeHint());
        }
        return form;
    }

    private void applyAuthorization(HttpHeaders headers) {
        if (settings.authorization() != null) {
            headers.set(HttpHeaders.AUTHORIZATION, settings.authorization());
        }
    }

    private record RawResponse(int status, byte[] body) {
    }
}
