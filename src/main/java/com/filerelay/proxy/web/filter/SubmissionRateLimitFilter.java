package com.filerelay.proxy.web.filter;

import com.filerelay.proxy.metrics.RelayMetrics;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Caps how many requests per minute a route accepts, so a runaway caller cannot flood the
 * shared folder with drafts. Rejected requests get 429 with {@code Retry-After}. Paths outside the
 * configured routes are not counted.
 */
public class SubmissionRateLimitFilter implements WebFilter, Ordered {

    private final RelayMetrics metrics;
    private final Map<String, Bucket> buckets;

    public SubmissionRateLimitFilter(int perMinute, Collection<String> routes, RelayMetrics metrics) {
        this.metrics = metrics;
        Map<String, Bucket> byRoute = new HashMap<>();
        routes.forEach(route -> byRoute.put(route, newBucket(perMinute)));
        this.buckets = Map.copyOf(byRoute);
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String route = routeOf(exchange.getRequest().getPath().value());
        Bucket bucket = buckets.get(route);
        if (bucket == null) {
            return chain.filter(exchange);
        }
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            return chain.filter(exchange);
        }
        var resp = exchange.getResponse();
        if (resp.isCommitted()) return Mono.empty();
        long retryAfter = Math.max(1, Duration.ofNanos(probe.getNanosToWaitForRefill()).toSeconds());
        resp.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        resp.getHeaders().set("Retry-After", String.valueOf(retryAfter));
        metrics.incrementThrottled();
        return resp.setComplete();
    }

    private static Bucket newBucket(int perMinute) {
        Bandwidth limit = Bandwidth.builder()
                .capacity(perMinute)
                .refillIntervally(perMinute, Duration.ofMinutes(1))
                .build();
        return Bucket.builder().addLimit(limit).build();
    }

    static String routeOf(String path) {
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) return segment;
        }
        return "";
    }
}
