package com.demo.introspection.exception;

import java.util.Objects;

/**
 * 在 CompletableFuture 的失败通道中携带 {@link IntrospectionError}。
 */
public class IntrospectionException extends RuntimeException {

    private final transient IntrospectionError error;

    public IntrospectionException(IntrospectionError error) {
        super(Objects.requireNonNull(error, "error must not be null").detail(), causeOf(error));
        this.error = error;
    }

    public IntrospectionError getError() {
        return error;
    }

    private static Throwable causeOf(IntrospectionError error) {
        if (error instanceof IntrospectionError.ClientError e) return e.cause();
        if (error instanceof IntrospectionError.NonParsableResponse e) return e.cause();
        if (error instanceof IntrospectionError.Unexpected e) return e.cause();
        return null;
    }
}
