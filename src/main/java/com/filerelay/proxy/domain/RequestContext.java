package com.filerelay.proxy.domain;

import org.springframework.http.HttpMethod;

/**
 * Per-transaction logging context; {@code name} is the transaction identity name.
 */
public record RequestContext(
        String traceId,
        String name,
        String route,
        HttpMethod method,
        String targetUrl,
        long startNanos
) {}
