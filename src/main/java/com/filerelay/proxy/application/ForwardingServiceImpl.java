package com.filerelay.proxy.application;

import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import com.filerelay.proxy.domain.RequestContext;
import com.filerelay.proxy.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Sends a request through the gateway configured for its route.
 */
@Service("forwardingCore")
public class ForwardingServiceImpl implements ForwardingService {

    private static final Logger log = LoggerFactory.getLogger(ForwardingServiceImpl.class);

    private final RelayRoutes routes;
    private final RelayMetrics metrics;

    public ForwardingServiceImpl(RelayRoutes routes, RelayMetrics metrics) {
        this.routes = routes;
        this.metrics = metrics;
    }

    @Override
    public Mono<ForwardResponse> forward(ForwardRequest req, RequestContext ctx) {
        long t0 = ctx.startNanos();
        return Mono.defer(() -> routes.get(ctx.route()).gateway().exchange(req))
                .doOnNext(res -> {
                    long nanos = System.nanoTime() - t0;
                    long ms = nanos / 1_000_000;
                    int size = res.body() != null ? res.body().length : 0;
                    String pat = "[{}:{}] <- {} ({} bytes) in {} ms";
                    if (res.status() >= 500)      log.error(pat, ctx.traceId(), ctx.name(), res.status(), size, ms);
                    else if (res.status() >= 400) log.warn (pat, ctx.traceId(), ctx.name(), res.status(), size, ms);
                    else                          log.info (pat, ctx.traceId(), ctx.name(), res.status(), size, ms);
                    metrics.recordForward(ctx.route(), res.status(), Duration.ofNanos(nanos));
                });
    }
}
