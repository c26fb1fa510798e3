package com.demo.introspection.client;

import com.demo.introspection.model.IntrospectionVerdict;

import java.util.concurrent.CompletableFuture;

/**
 * 调用远程内省服务（RFC 7662）。
 * <p>
 * 每次调用只发起一次网络请求，不做重试。失败时 future 以
 * {@link com.demo.introspection.exception.IntrospectionException} 异常完成。
 */
public interface IntrospectionClient {

    CompletableFuture<IntrospectionVerdict> introspect(String token);
}
