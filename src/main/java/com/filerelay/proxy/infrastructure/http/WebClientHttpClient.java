package com.filerelay.proxy.infrastructure.http;

import com.filerelay.proxy.domain.ForwardRequest;
import com.filerelay.proxy.domain.ForwardResponse;
import com.filerelay.proxy.service.ForwardingException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * Direct strategy. Redirects are not followed; they reach the caller as recorded.
 */
public class WebClientHttpClient implements HttpClientGateway {

    private static final byte[] EMPTY = new byte[0];
    private final WebClient webClient;

    public WebClientHttpClient(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<ForwardResponse> exchange(ForwardRequest req) {
        return webClient.method(req.method())
                .uri(req.targetUri())
                .headers(h -> h.addAll(req.headers()))
                .body(req.hasBody() ? BodyInserters.fromValue(req.body()) : BodyInserters.empty())
                // 4xx/5xx are relayed, not raised
                .exchangeToMono(resp -> resp.toEntity(byte[].class))
                .map(ent -> new ForwardResponse(
                        ent.getStatusCode().value(),
                        reasonPhrase(ent.getStatusCode().value()),
                        ent.getHeaders(),
                        ent.getBody() != null ? ent.getBody() : EMPTY
                ))
                .onErrorMap(WebClientRequestException.class,
                        e -> new ForwardingException("Cannot reach " + req.targetUri() + ": " + rootMessage(e), e));
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private static String reasonPhrase(int status) {
        HttpStatus known = HttpStatus.resolve(status);
        return known != null ? known.getReasonPhrase() : "";
    }
}
