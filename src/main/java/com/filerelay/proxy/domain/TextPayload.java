package com.filerelay.proxy.domain;

import java.util.Objects;

public record TextPayload(String text) implements Payload {

    static final TextPayload EMPTY = new TextPayload("");

    public TextPayload {
        Objects.requireNonNull(text, "text");
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public String type() {
        return STRING;
    }
}
