package com.filerelay.proxy.domain;

/**
 * Body of a request or response as stored in a transaction file.
 * <p>
 * Exactly one of {@link JsonPayload}, {@link TextPayload} or {@link BinaryPayload};
 * {@link #type()} is the tag written next to the value on disk.
 */
public interface Payload {

    String JSON = "json";
    String STRING = "string";
    String BASE64 = "base64";

    String type();

    static Payload empty() {
        return TextPayload.EMPTY;
    }
}
