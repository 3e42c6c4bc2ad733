package com.filerelay.proxy.domain;

import org.springframework.http.HttpHeaders;

public record ForwardResponse(
        int status,
        String statusText,
        HttpHeaders headers,
        byte[] body
) {}
