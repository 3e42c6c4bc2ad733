package com.filerelay.proxy.infrastructure.command;

import com.filerelay.proxy.domain.ForwardResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recovers a response from the text printed by {@code curl -v}.
 * <p>
 * {@code < HTTP/...} starts a response block and discards the previous one, so after a redirect
 * chain the last block wins. {@code < name: value} lines are headers, {@code >} and {@code *}
 * lines are request and connection traces, anything else is body. Without a status line the
 * result is an empty 204.
 */
public final class CurlTraceParser {

    private static final Logger log = LoggerFactory.getLogger(CurlTraceParser.class);

    static final int NO_STATUS = 204;
    private static final Set<String> BARE_MARKERS = Set.of("*", "<", ">");

    private CurlTraceParser() {}

    public static ForwardResponse parse(String output) {
        Integer status = null;
        String statusText = "";
        HttpHeaders headers = new HttpHeaders();
        List<String> body = new ArrayList<>();

        for (String raw : output.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || BARE_MARKERS.contains(line)) {
                continue;
            }
            if (line.startsWith("* ") || line.startsWith("> ")) {
                log.trace("trace: {}", line);
                continue;
            }
            if (line.startsWith("< HTTP/")) {
                String[] parts = line.split(" ", 4);
                status = parts.length > 2 ? statusCode(parts[2]) : null;
                statusText = parts.length > 3 ? parts[3] : "";
                headers = new HttpHeaders();
                log.debug("status: {} {}", status, statusText);
                continue;
            }
            if (line.startsWith("< ")) {
                String header = line.substring(2);
                int colon = header.indexOf(':');
                String name = (colon >= 0 ? header.substring(0, colon) : header).strip().toLowerCase(Locale.ROOT);
                String value = colon >= 0 ? header.substring(colon + 1).strip() : "";
                headers.set(name, value);
                continue;
            }
            body.add(line);
        }

        byte[] content = String.join("\n", body).getBytes(StandardCharsets.UTF_8);
        if (status == null) {
            return new ForwardResponse(NO_STATUS, statusText, new HttpHeaders(), content);
        }
        return new ForwardResponse(status, statusText, headers, content);
    }

    /** Three-digit code, or {@code null} for anything else. */
    static Integer statusCode(String token) {
        if (token.length() != 3 || !token.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return null;
        }
        return Integer.valueOf(token);
    }
}
