package com.filerelay.proxy.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.filerelay.proxy.domain.ProcessingResult;
import com.filerelay.proxy.domain.RelayedResponse;
import com.filerelay.proxy.domain.TransactionRecord;
import com.filerelay.proxy.domain.TransactionStats;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes transaction files, and produces the canonical form used for identity names.
 */
@Component
public class TransactionJson {

    static final String METHOD = "method";
    static final String PATH = "path";
    static final String QUERY_STRING = "query_string";
    static final String FOLDER = "folder";
    static final String HEADERS = "headers";
    static final String PAYLOAD = "payload";
    static final String TYPE = "type";
    static final String STATS = "stats";
    static final String ORIGINAL_HEADERS = "original_headers";
    static final String SERVER_HEADERS = "server_headers";
    static final String RESPONSE = "response";
    static final String STATUS_CODE = "status_code";
    static final String STATUS_TEXT = "status_text";
    static final String ERROR = "error";

    private final ObjectMapper mapper;
    private final ObjectWriter pretty;
    private final ObjectWriter compact;
    private final DataCodec codec;

    public TransactionJson(ObjectMapper objectMapper, DataCodec codec) {
        this.mapper = objectMapper;
        this.pretty = objectMapper.writerWithDefaultPrettyPrinter();
        this.compact = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.codec = codec;
    }

    /**
     * Compact JSON of the identity fields only, with header names sorted.
     */
    public String canonicalIdentity(TransactionRecord record) {
        ObjectNode core = mapper.createObjectNode();
        core.put(METHOD, record.method());
        core.put(PATH, record.path());
        core.put(QUERY_STRING, record.queryString());
        core.put(FOLDER, record.folder());
        core.set(HEADERS, headersNode(new TreeMap<>(record.headers())));
        core.set(PAYLOAD, codec.toValue(record.payload()));
        core.put(TYPE, record.payload().type());
        try {
            return compact.writeValueAsString(core);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize request identity", e);
        }
    }

    public byte[] write(TransactionRecord record) {
        try {
            return pretty.writeValueAsBytes(toNode(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize transaction", e);
        }
    }

    public byte[] write(ProcessingResult result) {
        if (result instanceof ProcessingResult.Completed completed) {
            return write(completed.record());
        }
        ObjectNode error = mapper.createObjectNode();
        error.put(ERROR, ((ProcessingResult.Failed) result).reason());
        try {
            return pretty.writeValueAsBytes(error);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize error sentinel", e);
        }
    }

    public TransactionRecord readRecord(byte[] content) throws IOException {
        return fromNode(mapper.readTree(content));
    }

    /**
     * Interprets a sent artifact. Anything without a response status is a failure.
     */
    public ProcessingResult readResult(byte[] content) throws IOException {
        JsonNode node = mapper.readTree(content);
        JsonNode response = node.path(RESPONSE);
        if (response.path(STATUS_CODE).canConvertToInt()) {
            return ProcessingResult.completed(fromNode(node));
        }
        if (node.hasNonNull(ERROR)) {
            return ProcessingResult.failed(node.get(ERROR).asText());
        }
        return ProcessingResult.failed("no response status recorded");
    }

    ObjectNode toNode(TransactionRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put(METHOD, record.method());
        node.put(PATH, record.path());
        node.put(QUERY_STRING, record.queryString());
        node.put(FOLDER, record.folder());
        node.set(HEADERS, headersNode(record.headers()));
        node.set(PAYLOAD, codec.toValue(record.payload()));
        node.put(TYPE, record.payload().type());
        node.set(STATS, statsNode(record.stats()));
        node.set(ORIGINAL_HEADERS, headersNode(record.originalHeaders()));
        node.set(SERVER_HEADERS, headersNode(record.serverHeaders()));
        if (record.response() != null) {
            node.set(RESPONSE, responseNode(record.response()));
        }
        return node;
    }

    TransactionRecord fromNode(JsonNode node) {
        if (!node.hasNonNull(METHOD) || !node.hasNonNull(PATH)) {
            throw new IllegalArgumentException("transaction without method or path");
        }
        RelayedResponse response = null;
        JsonNode r = node.path(RESPONSE);
        if (r.path(STATUS_CODE).canConvertToInt()) {
            response = new RelayedResponse(
                    r.get(STATUS_CODE).asInt(),
                    r.path(STATUS_TEXT).asText(""),
                    headers(r.path(HEADERS)),
                    codec.fromValue(r.get(PAYLOAD), r.path(TYPE).asText()));
        }
        Map<String, String> hashHeaders = headers(node.path(HEADERS));
        return new TransactionRecord(
                node.get(METHOD).asText(),
                node.get(PATH).asText(),
                node.path(QUERY_STRING).asText(""),
                node.path(FOLDER).asText(""),
                hashHeaders,
                codec.fromValue(node.get(PAYLOAD), node.path(TYPE).asText()),
                stats(node.path(STATS)),
                headers(node.path(ORIGINAL_HEADERS)),
                node.has(SERVER_HEADERS) ? headers(node.get(SERVER_HEADERS)) : hashHeaders,
                response);
    }

    private ObjectNode responseNode(RelayedResponse response) {
        ObjectNode node = mapper.createObjectNode();
        node.put(STATUS_CODE, response.statusCode());
        node.put(STATUS_TEXT, response.statusText());
        node.set(HEADERS, headersNode(response.headers()));
        node.set(PAYLOAD, codec.toValue(response.payload()));
        node.put(TYPE, response.payload().type());
        return node;
    }

    private ObjectNode statsNode(TransactionStats stats) {
        ObjectNode node = mapper.createObjectNode();
        if (stats == null) {
            return node;
        }
        putInstant(node, "created_at", stats.createdAt());
        putInstant(node, "started_at", stats.startedAt());
        putInstant(node, "finished_at", stats.finishedAt());
        if (stats.elapsedTotal() != null) node.put("elapsed_total", stats.elapsedTotal());
        if (stats.elapsedRequest() != null) node.put("elapsed_request", stats.elapsedRequest());
        return node;
    }

    private TransactionStats stats(JsonNode node) {
        if (!node.isObject()) {
            return TransactionStats.none();
        }
        return new TransactionStats(
                instant(node.path("created_at")),
                instant(node.path("started_at")),
                instant(node.path("finished_at")),
                node.path("elapsed_request").isNumber() ? node.get("elapsed_request").asDouble() : null,
                node.path("elapsed_total").isNumber() ? node.get("elapsed_total").asDouble() : null);
    }

    private ObjectNode headersNode(Map<String, String> headers) {
        ObjectNode node = mapper.createObjectNode();
        if (headers != null) {
            headers.forEach(node::put);
        }
        return node;
    }

    private static Map<String, String> headers(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText()));
        }
        return out;
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value != null) node.put(field, value.toString());
    }

    // Timestamps written by other producers may carry an explicit offset instead of 'Z'.
    private static Instant instant(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(node.asText()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
