package com.filerelay.proxy.web.filter;

import com.filerelay.proxy.metrics.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionRateLimitFilterTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SubmissionRateLimitFilter filter = new SubmissionRateLimitFilter(2, List.of("dev", "prod"),
            new RelayMetrics(registry));
    private final AtomicInteger chainCalls = new AtomicInteger();
    private final WebFilterChain chain = ex -> { chainCalls.incrementAndGet(); return Mono.empty(); };

    private MockServerWebExchange call(String path) {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get(path).build());
        filter.filter(exchange, chain).block();
        return exchange;
    }

    @Test
    void requests_within_the_budget_pass_through() {
        MockServerWebExchange first = call("/dev/items");
        MockServerWebExchange second = call("/dev/items/2");

        assertThat(chainCalls).hasValue(2);
        assertThat(first.getResponse().getStatusCode()).isNull();
        assertThat(second.getResponse().getStatusCode()).isNull();
    }

    @Test
    void exhausted_route_gets_429_with_retry_after() {
        call("/dev/a");
        call("/dev/b");
        MockServerWebExchange third = call("/dev/c");

        assertThat(chainCalls).hasValue(2);
        assertThat(third.getResponse().getStatusCode().value()).isEqualTo(429);
        assertThat(Long.parseLong(third.getResponse().getHeaders().getFirst("Retry-After"))).isPositive();
        assertThat(registry.find("relay_submissions_throttled_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void routes_have_separate_budgets() {
        call("/dev/a");
        call("/dev/b");
        MockServerWebExchange other = call("/prod/a");

        assertThat(other.getResponse().getStatusCode()).isNull();
        assertThat(chainCalls).hasValue(3);
    }

    @Test
    void unknown_routes_pass_through_unthrottled() {
        for (int i = 0; i < 5; i++) {
            call("/nope/" + i);
        }
        MockServerWebExchange root = call("/");

        assertThat(chainCalls).hasValue(6);
        assertThat(root.getResponse().getStatusCode()).isNull();
        assertThat(registry.find("relay_submissions_throttled_total").counter()).isNull();
    }

    @Test
    void route_is_first_non_empty_segment() {
        assertThat(SubmissionRateLimitFilter.routeOf("//dev/x")).isEqualTo("dev");
        assertThat(SubmissionRateLimitFilter.routeOf("/")).isEmpty();
    }
}
