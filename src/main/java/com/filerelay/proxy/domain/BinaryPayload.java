package com.filerelay.proxy.domain;

import java.util.Arrays;
import java.util.Base64;

public record BinaryPayload(byte[] bytes) implements Payload {

    public BinaryPayload {
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public String type() {
        return BASE64;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BinaryPayload other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "BinaryPayload[" + Base64.getEncoder().encodeToString(bytes) + "]";
    }
}
