package com.filerelay.proxy.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.TextNode;
import com.filerelay.proxy.domain.BinaryPayload;
import com.filerelay.proxy.domain.JsonPayload;
import com.filerelay.proxy.domain.Payload;
import com.filerelay.proxy.domain.TextPayload;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Maps raw HTTP bodies to {@link Payload} values and back.
 * <p>
 * UTF-8 text that parses as a single JSON document becomes {@link JsonPayload}, other UTF-8
 * text becomes {@link TextPayload}, anything else {@link BinaryPayload}. JSON bodies round-trip
 * by structure: whitespace and number formatting may differ from the original bytes.
 */
@Component
public class DataCodec {

    private static final byte[] EMPTY = new byte[0];

    private final ObjectMapper mapper;

    public DataCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    public Payload encode(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return Payload.empty();
        }
        Optional<String> text = decodeUtf8(raw);
        if (text.isEmpty()) {
            return new BinaryPayload(raw);
        }
        return parseJson(text.get())
                .<Payload>map(JsonPayload::new)
                .orElseGet(() -> new TextPayload(text.get()));
    }

    public byte[] decode(Payload payload) {
        if (payload == null) {
            return EMPTY;
        }
        if (payload instanceof BinaryPayload binary) {
            return binary.bytes();
        }
        if (payload instanceof JsonPayload json) {
            try {
                return mapper.writeValueAsBytes(json.value());
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("cannot serialize JSON payload", e);
            }
        }
        return ((TextPayload) payload).text().getBytes(StandardCharsets.UTF_8);
    }

    /** The value stored under {@code payload} in a transaction file. */
    public JsonNode toValue(Payload payload) {
        if (payload instanceof JsonPayload json) {
            return json.value();
        }
        if (payload instanceof BinaryPayload binary) {
            return TextNode.valueOf(Base64.getEncoder().encodeToString(binary.bytes()));
        }
        return TextNode.valueOf(payload == null ? "" : ((TextPayload) payload).text());
    }

    /** Reads a {@code payload}/{@code type} pair; unknown tags are kept as text. */
    public Payload fromValue(JsonNode value, String type) {
        if (value == null || value.isMissingNode()) {
            return Payload.empty();
        }
        if (Payload.BASE64.equals(type)) {
            return new BinaryPayload(Base64.getDecoder().decode(value.asText()));
        }
        if (Payload.JSON.equals(type)) {
            return new JsonPayload(value);
        }
        return new TextPayload(value.isTextual() ? value.asText() : value.toString());
    }

    private Optional<String> decodeUtf8(byte[] raw) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private Optional<JsonNode> parseJson(String text) {
        try {
            JsonNode node = mapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
