package com.filerelay.proxy.infrastructure.command;

import com.filerelay.proxy.domain.ForwardRequest;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A shell script with curl placeholders.
 * <ul>
 *   <li>{@code {{METHOD}}} upper-case method</li>
 *   <li>{@code {{URL}}} target URL, shell-quoted</li>
 *   <li>{@code {{HEADERS}}} one {@code -H 'name: value'} per header</li>
 *   <li>{@code {{DATA}}} {@code -d '<body>'}, binary bodies base64-encoded</li>
 *   <li>{@code {{CURL_OPTS}}} {@code -v}, {@code -X <method>} unless GET, headers and data</li>
 * </ul>
 * The script must leave curl's verbose trace on stdout or stderr.
 */
public final class CommandTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(METHOD|URL|HEADERS|DATA|CURL_OPTS)\\}\\}");
    private static final Pattern SHELL_SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");

    private final String text;

    public CommandTemplate(String text) {
        this.text = text;
    }

    public static CommandTemplate load(Path file) throws IOException {
        return new CommandTemplate(Files.readString(file, StandardCharsets.UTF_8));
    }

    public String render(ForwardRequest req) {
        String method = req.method().name().toUpperCase(Locale.ROOT);
        String headers = headerFlags(req);
        String data = dataFlag(req.body());

        List<String> opts = new ArrayList<>();
        opts.add("-v");
        if (!"GET".equals(method)) opts.add("-X " + method);
        if (!headers.isEmpty()) opts.add(headers);
        if (!data.isEmpty()) opts.add(data);

        Map<String, String> values = new LinkedHashMap<>();
        values.put("METHOD", method);
        values.put("URL", shellQuote(req.targetUri().toString()));
        values.put("HEADERS", headers);
        values.put("DATA", data);
        values.put("CURL_OPTS", String.join(" ", opts));

        // single pass: substituted text is never rescanned for placeholders
        return PLACEHOLDER.matcher(text).replaceAll(m -> Matcher.quoteReplacement(values.get(m.group(1))));
    }

    static String headerFlags(ForwardRequest req) {
        List<String> parts = new ArrayList<>();
        req.headers().forEach((name, values) ->
                parts.add("-H '" + name + ": " + escape(String.join(", ", values)) + "'"));
        return String.join(" ", parts);
    }

    static String dataFlag(byte[] body) {
        if (body == null || body.length == 0) {
            return "";
        }
        return "-d '" + escape(asText(body)) + "'";
    }

    static String shellQuote(String s) {
        if (s.isEmpty()) return "''";
        if (SHELL_SAFE.matcher(s).matches()) return s;
        return "'" + s.replace("'", "'\"'\"'") + "'";
    }

    private static String escape(String value) {
        return value.replace("'", "'\\''");
    }

    private static String asText(byte[] body) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            return Base64.getEncoder().encodeToString(body);
        }
    }
}
