package com.filerelay.proxy.application;

import com.filerelay.proxy.codec.DataCodec;
import com.filerelay.proxy.domain.EncodedRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import com.filerelay.proxy.domain.InboundRequest;
import com.filerelay.proxy.domain.ProcessingResult;
import com.filerelay.proxy.domain.RelayedResponse;
import com.filerelay.proxy.metrics.RelayMetrics;
import com.filerelay.proxy.service.RelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

/**
 * Client side of the relay: answers from sent when the cache policy allows it, otherwise
 * submits a draft and waits for the server to finish it.
 */
@Service
public class RelayClientService {

    private static final Logger log = LoggerFactory.getLogger(RelayClientService.class);
    private static final byte[] EMPTY = new byte[0];

    private final RelayRoutes routes;
    private final CanonicalRequestEncoder encoder;
    private final CacheResolver cache;
    private final TransactionWaiter waiter;
    private final HeaderPolicy headerPolicy;
    private final DataCodec codec;
    private final RelayMetrics metrics;

    public RelayClientService(RelayRoutes routes, CanonicalRequestEncoder encoder, CacheResolver cache,
                              TransactionWaiter waiter, HeaderPolicy headerPolicy, DataCodec codec,
                              RelayMetrics metrics) {
        this.routes = routes;
        this.encoder = encoder;
        this.cache = cache;
        this.waiter = waiter;
        this.headerPolicy = headerPolicy;
        this.codec = codec;
        this.metrics = metrics;
    }

    public Mono<ForwardResponse> relay(InboundRequest in) {
        RouteBinding route = routes.find(in.route()).orElse(null);
        if (route == null) {
            return Mono.error(new RelayException(HttpStatus.NOT_FOUND, "Unknown route " + in.route() + "."));
        }
        metrics.recordRequest(route.name(), in.method());
        String traceId = UUID.randomUUID().toString().substring(0, 8);

        return Mono.fromCallable(() -> encode(in))
                .flatMap(encoded -> cache.resolve(route.queue(), encoded.name(), in.method())
                        .map(hit -> {
                            log.info("[{}:{}] replaying {} from sent", traceId, encoded.name(), hit.statusCode());
                            metrics.recordCacheHit(route.name());
                            return Mono.just(toClient(hit));
                        })
                        .orElseGet(() -> submitAndWait(route, encoded, traceId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private EncodedRequest encode(InboundRequest in) {
        try {
            return encoder.encode(in);
        } catch (RuntimeException e) {
            throw new RelayException(HttpStatus.BAD_REQUEST, "Cannot encode request: " + e.getMessage(), e);
        }
    }

    private Mono<ForwardResponse> submitAndWait(RouteBinding route, EncodedRequest encoded, String traceId) {
        route.queue().submit(encoded.name(), encoded.record());
        log.info("[{}:{}] -> {} {} submitted to {} headers={}", traceId, encoded.name(),
                encoded.record().method(), encoded.record().path(), route.name(),
                HeaderMasking.mask(encoded.record().originalHeaders()));
        return waiter.await(route.queue(), encoded.name())
                .map(result -> {
                    if (result instanceof ProcessingResult.Completed completed) {
                        return toClient(completed.response());
                    }
                    log.warn("[{}:{}] transaction failed: {}", traceId, encoded.name(),
                            ((ProcessingResult.Failed) result).reason());
                    return failure();
                });
    }

    private ForwardResponse toClient(RelayedResponse response) {
        return new ForwardResponse(
                response.statusCode(),
                response.statusText(),
                headerPolicy.toClient(response.headers()),
                codec.decode(response.payload()));
    }

    private static ForwardResponse failure() {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        return new ForwardResponse(status.value(), status.getReasonPhrase(), new HttpHeaders(), EMPTY);
    }
}
