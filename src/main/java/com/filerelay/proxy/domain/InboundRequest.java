package com.filerelay.proxy.domain;

import org.springframework.http.HttpHeaders;

/**
 * A caller request as received by the local listener, with the route segment split off.
 */
public record InboundRequest(
        String method,
        String route,
        String path,
        String queryString,
        HttpHeaders headers,
        byte[] body
) {}
