package com.filerelay.proxy.management;

import com.filerelay.proxy.metrics.RelayMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

@Component
@Endpoint(id = "relaystats")
public class RelayStatsEndpoint {

    private final MeterRegistry registry;

    public RelayStatsEndpoint(MeterRegistry registry) {
        this.registry = registry;
    }

    @ReadOperation
    public Map<String, Object> stats() {
        Map<String, Object> out = new TreeMap<>();

        out.put("requests_by_route", sumByTag(RelayMetrics.REQUESTS, "route"));
        out.put("cache_hits_by_route", sumByTag(RelayMetrics.CACHE_HITS, "route"));
        out.put("transactions_by_outcome", sumByTag(RelayMetrics.TRANSACTIONS, "outcome"));

        Map<String, Object> forwards = new TreeMap<>();
        registry.find(RelayMetrics.FORWARD_DURATION).timers().forEach(t -> {
            String key = t.getId().getTag("route") + "/" + t.getId().getTag("status_class");
            forwards.put(key, Map.of(
                    "count", t.count(),
                    "mean_ms", t.mean(TimeUnit.MILLISECONDS),
                    "max_ms", t.max(TimeUnit.MILLISECONDS)));
        });
        out.put("forwards", forwards);

        Counter throttled = Search.in(registry).name(RelayMetrics.THROTTLED).counter();
        out.put("submissions_throttled_total", throttled != null ? throttled.count() : 0d);

        return out;
    }

    private Map<String, Double> sumByTag(String meter, String tag) {
        Map<String, Double> totals = new TreeMap<>();
        registry.find(meter).counters().forEach(c -> {
            String key = c.getId().getTag(tag);
            totals.merge(key != null ? key : "unknown", c.count(), Double::sum);
        });
        return totals;
    }
}
