package com.filerelay.proxy.infrastructure.http;

import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import reactor.core.publisher.Mono;

/**
 * Bounds a route's direct calls with a time limit and stops calling a backend that keeps
 * failing. A rejected or timed out call ends the transaction as failed.
 */
public class ResilientHttpClientGateway implements HttpClientGateway {

    private final HttpClientGateway delegate;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;

    public ResilientHttpClientGateway(HttpClientGateway delegate, CircuitBreaker circuitBreaker, TimeLimiter timeLimiter) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
    }

    @Override
    public Mono<ForwardResponse> exchange(ForwardRequest request) {
        return Mono.defer(() -> delegate.exchange(request))
                .transformDeferred(TimeLimiterOperator.of(timeLimiter))
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
    }

    public String name() {
        return circuitBreaker.getName();
    }
}
