package com.filerelay.proxy.infrastructure.command;

import com.filerelay.proxy.domain.ForwardResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CurlTraceParserTest {

    @Test
    void last_status_block_wins_after_redirect() {
        String trace = String.join("\n",
                "*   Trying 10.0.0.5:443...",
                "* Connected to api.internal (10.0.0.5) port 443",
                "> GET /items HTTP/1.1",
                "> Host: api.internal",
                ">",
                "< HTTP/1.1 302 Found",
                "< Location: /items/",
                "< Set-Cookie: a=1",
                "<",
                "* Issue another request to this URL: 'https://api.internal/items/'",
                "> GET /items/ HTTP/1.1",
                "< HTTP/1.1 200 OK",
                "< Content-Type: application/json",
                "< X-Request-Id: abc",
                "<",
                "{\"items\":[]}",
                "* Connection #0 to host api.internal left intact");

        ForwardResponse res = CurlTraceParser.parse(trace);

        assertThat(res.status()).isEqualTo(200);
        assertThat(res.statusText()).isEqualTo("OK");
        assertThat(res.headers().toSingleValueMap())
                .containsOnlyKeys("content-type", "x-request-id")
                .containsEntry("content-type", "application/json");
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("{\"items\":[]}");
    }

    @Test
    void body_lines_are_trimmed_and_joined() {
        String trace = "< HTTP/2 404 \r\n< content-type: text/plain\r\n\r\n  not\r\n  found  \r\n";

        ForwardResponse res = CurlTraceParser.parse(trace);

        assertThat(res.status()).isEqualTo(404);
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("not\nfound");
    }

    @Test
    void repeated_header_keeps_last_value() {
        ForwardResponse res = CurlTraceParser.parse("< HTTP/1.1 200 OK\n< X-A: 1\n< x-a: 2\n");

        assertThat(res.headers().get("x-a")).containsExactly("2");
    }

    @Test
    void output_without_status_line_is_204() {
        ForwardResponse res = CurlTraceParser.parse("* Could not resolve host\nsome text");

        assertThat(res.status()).isEqualTo(204);
        assertThat(res.headers()).isEmpty();
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("some text");
    }

    @Test
    void oversized_status_token_counts_as_no_status() {
        ForwardResponse res = CurlTraceParser.parse("< HTTP/1.1 99999999999 X\n< X-A: 1\n\nbody");

        assertThat(res.status()).isEqualTo(204);
        assertThat(res.headers()).isEmpty();
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("body");
    }

    @Test
    void status_code_accepts_three_digits_only() {
        assertThat(CurlTraceParser.statusCode("201")).isEqualTo(201);
        assertThat(CurlTraceParser.statusCode("20")).isNull();
        assertThat(CurlTraceParser.statusCode("2000")).isNull();
        assertThat(CurlTraceParser.statusCode("abc")).isNull();
        assertThat(CurlTraceParser.statusCode("")).isNull();
    }
}
