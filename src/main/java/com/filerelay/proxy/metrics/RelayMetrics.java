package com.filerelay.proxy.metrics;

import com.filerelay.proxy.domain.ProcessingResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class RelayMetrics {

    public static final String REQUESTS = "relay_requests_total";
    public static final String CACHE_HITS = "relay_cache_hits_total";
    public static final String TRANSACTIONS = "relay_transactions_total";
    public static final String FORWARD_DURATION = "relay_forward_duration_seconds";
    public static final String THROTTLED = "relay_submissions_throttled_total";

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRequest(String route, String method) {
        Counter.builder(REQUESTS)
                .description("Requests received by the local listener")
                .tags("route", safe(route), "method", safe(method))
                .register(registry)
                .increment();
    }

    public void recordCacheHit(String route) {
        Counter.builder(CACHE_HITS)
                .description("Requests answered from the sent folder")
                .tags("route", safe(route))
                .register(registry)
                .increment();
    }

    public void recordTransaction(String route, ProcessingResult result) {
        String outcome = result instanceof ProcessingResult.Completed ? "completed" : "failed";
        Counter.builder(TRANSACTIONS)
                .description("Transactions processed by the server loop")
                .tags("route", safe(route), "outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordForward(String route, int statusCode, Duration duration) {
        Timer.builder(FORWARD_DURATION)
                .description("Time spent calling the backend")
                .tags("route", safe(route), "status_class", statusCode / 100 + "xx")
                .register(registry)
                .record(duration);
    }

    public void incrementThrottled() {
        Counter.builder(THROTTLED)
                .description("Submissions rejected by the per-route throttle")
                .register(registry)
                .increment();
    }

    private static String safe(String s) {
        return s == null ? "UNKNOWN" : s;
    }
}
