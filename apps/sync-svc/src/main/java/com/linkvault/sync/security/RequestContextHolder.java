package com.linkvault.sync.security;

import java.util.Optional;
import java.util.UUID;

public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static void setUserId(UUID userId) {
        RequestContext current = CONTEXT.get();
        CONTEXT.set(current == null ? new RequestContext(userId, null) : current.withUserId(userId));
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static String currentTraceId() {
        return get().map(RequestContext::traceId).orElse(null);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(UUID userId, String traceId) {

        public static RequestContext ofTrace(String traceId) {
            return new RequestContext(null, traceId);
        }

        public RequestContext withUserId(UUID newUserId) {
            return new RequestContext(newUserId, traceId);
        }
    }
}
