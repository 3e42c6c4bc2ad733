package com.filerelay.proxy.application;

import com.filerelay.proxy.codec.DataCodec;
import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import com.filerelay.proxy.domain.ProcessingResult;
import com.filerelay.proxy.domain.RelayedResponse;
import com.filerelay.proxy.domain.RequestContext;
import com.filerelay.proxy.domain.TextPayload;
import com.filerelay.proxy.domain.TransactionRecord;
import com.filerelay.proxy.metrics.RelayMetrics;
import com.filerelay.proxy.service.ForwardingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Server side handling of a claimed transaction: forward it, record the outcome in sent and
 * clear the inbox. A forwarding failure becomes an error sentinel so a waiting client still
 * sees the transaction finish.
 */
public class TransactionProcessor {

    private static final Logger log = LoggerFactory.getLogger(TransactionProcessor.class);

    private final RelayRoutes routes;
    private final ForwardingService forwarding;
    private final HeaderPolicy headerPolicy;
    private final DataCodec codec;
    private final RelayMetrics metrics;
    private final Clock clock;

    public TransactionProcessor(RelayRoutes routes, ForwardingService forwarding, HeaderPolicy headerPolicy,
                                DataCodec codec, RelayMetrics metrics, Clock clock) {
        this.routes = routes;
        this.forwarding = forwarding;
        this.headerPolicy = headerPolicy;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Processes a transaction that is already in the route's inbox.
     */
    public ProcessingResult process(String route, String name) {
        RouteBinding binding = routes.get(route);
        String traceId = UUID.randomUUID().toString().substring(0, 8);
        ProcessingResult result;
        try {
            result = forward(binding, name, traceId);
        } catch (Exception e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("[{}:{}] processing failed: {}", traceId, name, cause.toString());
            result = ProcessingResult.failed(describe(cause));
        }
        binding.queue().complete(name, result);
        metrics.recordTransaction(route, result);
        return result;
    }

    private ProcessingResult forward(RouteBinding binding, String name, String traceId) throws Exception {
        Instant started = clock.instant();
        TransactionRecord record = binding.queue().readClaimed(name);

        HttpMethod method = HttpMethod.valueOf(record.method());
        String url = binding.targetUrl(record.path(), record.queryString());
        byte[] body = isEmpty(record) ? null : codec.decode(record.payload());
        HttpHeaders headers = headerPolicy.toBackend(record.serverHeaders());

        RequestContext ctx = new RequestContext(traceId, name, binding.name(), method, url, System.nanoTime());
        ForwardResponse response = forwarding.forward(new ForwardRequest(URI.create(url), method, headers, body), ctx)
                .block();
        if (response == null) {
            throw new ForwardingException("backend produced no response");
        }
        Instant finished = clock.instant();

        RelayedResponse relayed = new RelayedResponse(
                response.status(),
                response.statusText() == null ? "" : response.statusText(),
                flatten(response.headers()),
                codec.encode(response.body()));
        return ProcessingResult.completed(record.withResponse(relayed, record.stats().finished(started, finished)));
    }

    private static boolean isEmpty(TransactionRecord record) {
        return record.payload() instanceof TextPayload text && text.isEmpty();
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> out = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> out.put(k, String.join(", ", v)));
        }
        return out;
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getMessage() == null && root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.toString();
    }
}
