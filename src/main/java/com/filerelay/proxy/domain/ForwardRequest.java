package com.filerelay.proxy.domain;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.net.URI;

public record ForwardRequest(
        URI targetUri,
        HttpMethod method,
        HttpHeaders headers,
        byte[] body
) {

    public boolean hasBody() {
        return body != null && body.length > 0;
    }
}
