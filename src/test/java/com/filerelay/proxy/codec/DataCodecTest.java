package com.filerelay.proxy.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.filerelay.proxy.domain.BinaryPayload;
import com.filerelay.proxy.domain.JsonPayload;
import com.filerelay.proxy.domain.Payload;
import com.filerelay.proxy.domain.TextPayload;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class DataCodecTest {

    private final DataCodec codec = new DataCodec(new ObjectMapper());

    @Test
    void empty_body_is_empty_string() {
        Payload p = codec.encode(new byte[0]);

        assertThat(p).isEqualTo(new TextPayload(""));
        assertThat(p.type()).isEqualTo(Payload.STRING);
        assertThat(codec.decode(p)).isEmpty();
    }

    @Test
    void json_body_is_parsed_and_reencoded_compactly() {
        Payload p = codec.encode("{ \"a\" : 1,\n \"b\": [true, null] }".getBytes(StandardCharsets.UTF_8));

        assertThat(p).isInstanceOf(JsonPayload.class);
        assertThat(((JsonPayload) p).value().get("a").asInt()).isEqualTo(1);
        assertThat(new String(codec.decode(p), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1,\"b\":[true,null]}");
    }

    @Test
    void json_scalar_is_json() {
        Payload p = codec.encode("42".getBytes(StandardCharsets.UTF_8));

        assertThat(p.type()).isEqualTo(Payload.JSON);
        assertThat(new String(codec.decode(p), StandardCharsets.UTF_8)).isEqualTo("42");
    }

    @Test
    void trailing_content_after_json_is_plain_text() {
        String body = "{\"a\":1} trailing";
        Payload p = codec.encode(body.getBytes(StandardCharsets.UTF_8));

        assertThat(p).isEqualTo(new TextPayload(body));
        assertThat(new String(codec.decode(p), StandardCharsets.UTF_8)).isEqualTo(body);
    }

    @Test
    void non_json_text_is_kept_verbatim() {
        String body = "name=neil&x=1 ünïcode";
        Payload p = codec.encode(body.getBytes(StandardCharsets.UTF_8));

        assertThat(p.type()).isEqualTo(Payload.STRING);
        assertThat(codec.decode(p)).isEqualTo(body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void invalid_utf8_is_binary_and_round_trips_bytes() {
        byte[] raw = {(byte) 0xff, (byte) 0xfe, 0x00, 0x41, (byte) 0xc3};
        Payload p = codec.encode(raw);

        assertThat(p).isInstanceOf(BinaryPayload.class);
        assertThat(codec.toValue(p)).isEqualTo(TextNode.valueOf("//4AQcM="));
        assertThat(codec.decode(codec.fromValue(codec.toValue(p), p.type()))).isEqualTo(raw);
    }

    @Test
    void unknown_type_tag_is_read_as_text() {
        Payload p = codec.fromValue(TextNode.valueOf("hello"), "mystery");

        assertThat(p).isEqualTo(new TextPayload("hello"));
    }

    @Test
    void missing_value_is_empty() {
        assertThat(codec.fromValue(null, Payload.JSON)).isEqualTo(Payload.empty());
    }
}
