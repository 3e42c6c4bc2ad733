package com.filerelay.proxy.domain;

import java.util.Map;

public record RelayedResponse(
        int statusCode,
        String statusText,
        Map<String, String> headers,
        Payload payload
) {}
