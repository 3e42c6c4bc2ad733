package com.filerelay.proxy.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public record JsonPayload(JsonNode value) implements Payload {

    public JsonPayload {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String type() {
        return JSON;
    }
}
