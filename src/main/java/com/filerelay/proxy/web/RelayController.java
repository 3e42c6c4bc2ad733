package com.filerelay.proxy.web;

import com.filerelay.proxy.application.RelayClientService;
import com.filerelay.proxy.domain.InboundRequest;
import com.filerelay.proxy.service.RelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Local listener. {@code /<route>/<rest>} is relayed through the route's folders; the first
 * path segment only selects the route and is not part of the relayed path.
 */
@RestController
public class RelayController {
    private static final Logger log = LoggerFactory.getLogger(RelayController.class);
    private static final byte[] EMPTY = new byte[0];

    private final RelayClientService relay;

    public RelayController(RelayClientService relay) {
        this.relay = relay;
    }

    @RequestMapping("/**")
    public Mono<ResponseEntity<byte[]>> relayAll(ServerWebExchange ex) {
        var r = ex.getRequest();
        List<String> segments = segments(r.getPath().pathWithinApplication().value());
        if (segments.isEmpty()) {
            return Mono.error(new RelayException(HttpStatus.BAD_REQUEST,
                    "Please specify the relay route as the first path segment."));
        }
        String route = segments.get(0);
        String path = String.join("/", segments.subList(1, segments.size()));
        String query = r.getURI().getRawQuery() != null ? r.getURI().getRawQuery() : "";
        HttpMethod method = r.getMethod();

        return body(ex)
                .map(b -> new InboundRequest(method.name(), route, path, query, r.getHeaders(), b))
                .flatMap(relay::relay)
                .doOnError(e -> log.debug("relay of /{}/{} failed: {}", route, path, e.toString()))
                .map(res -> {
                    byte[] body = method == HttpMethod.HEAD || res.body() == null ? EMPTY : res.body();
                    return ResponseEntity
                            .status(res.status())
                            .headers(res.headers())
                            .body(body);
                });
    }

    private static List<String> segments(String path) {
        return Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private Mono<byte[]> body(ServerWebExchange ex) {
        return DataBufferUtils.join(ex.getRequest().getBody())
                .map((DataBuffer db) -> {
                    try {
                        byte[] bytes = new byte[db.readableByteCount()];
                        db.read(bytes);
                        return bytes;
                    } finally {
                        DataBufferUtils.release(db);
                    }
                })
                .defaultIfEmpty(EMPTY);
    }
}
