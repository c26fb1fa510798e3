package com.demo.introspection.security;

import org.springframework.http.HttpHeaders;

import java.util.Optional;

/**
 * 从请求头中提取令牌。
 * <p>
 * 约定：只读请求头，不修改请求；格式错误（如 scheme 不对）与未携带令牌同样返回 empty，
 * 不向调用方暴露具体原因。
 */
public interface TokenExtractor {

    Optional<String> extract(HttpHeaders headers);
}
