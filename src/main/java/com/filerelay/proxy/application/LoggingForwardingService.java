package com.filerelay.proxy.application;

import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import com.filerelay.proxy.domain.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

public class LoggingForwardingService implements ForwardingService {

    private static final Logger log = LoggerFactory.getLogger(LoggingForwardingService.class);
    private final ForwardingService delegate;

    public LoggingForwardingService(ForwardingService delegate) {
        this.delegate = delegate;
    }

    @Override
    public Mono<ForwardResponse> forward(ForwardRequest request, RequestContext ctx) {
        log.info("[{}:{}] forwarding {} {} headers={}", ctx.traceId(), ctx.name(), ctx.method(), ctx.targetUrl(),
                HeaderMasking.mask(request.headers()));
        return delegate.forward(request, ctx)
                .doOnError(e -> log.error("[{}:{}] transport error: {}", ctx.traceId(), ctx.name(), e.toString()));
    }
}
