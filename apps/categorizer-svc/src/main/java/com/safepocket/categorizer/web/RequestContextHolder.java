package com.safepocket.categorizer.web;

import java.util.Optional;

/**
 * Per-request data captured by {@link TraceIdFilter}, readable from anywhere on the request thread.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static Optional<String> path() {
        return get().map(RequestContext::path);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String traceId, String method, String path) {
    }
}
