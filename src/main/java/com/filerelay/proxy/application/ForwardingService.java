package com.filerelay.proxy.application;

import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import com.filerelay.proxy.domain.RequestContext;
import reactor.core.publisher.Mono;

public interface ForwardingService {
    Mono<ForwardResponse> forward(ForwardRequest request, RequestContext ctx);
}
