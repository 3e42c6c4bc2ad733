package com.filerelay.proxy.infrastructure.http;

import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import reactor.core.publisher.Mono;

/**
 * One way of reaching a backend. Any HTTP status is a response; only transport or execution
 * failures are errors.
 */
public interface HttpClientGateway {
    Mono<ForwardResponse> exchange(ForwardRequest request);
}
