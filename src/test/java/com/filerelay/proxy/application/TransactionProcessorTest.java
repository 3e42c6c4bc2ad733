package com.filerelay.proxy.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filerelay.proxy.codec.DataCodec;
import com.filerelay.proxy.codec.TransactionJson;
import com.filerelay.proxy.domain.CachePolicy;
import com.filerelay.proxy.domain.EncodedRequest;
import com.filerelay.proxy.domain.InboundRequest;
import com.filerelay.proxy.domain.ProcessingResult;
import com.filerelay.proxy.infrastructure.http.HttpClientGateway;
import com.filerelay.proxy.infrastructure.http.WebClientHttpClient;
import com.filerelay.proxy.metrics.RelayMetrics;
import com.filerelay.proxy.queue.AtomicRenameClaim;
import com.filerelay.proxy.queue.FolderQueue;
import com.filerelay.proxy.queue.RouteFolders;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TransactionProcessorTest {

    @TempDir
    Path base;

    private MockWebServer backend;
    private final ObjectMapper mapper = new ObjectMapper();
    private final DataCodec codec = new DataCodec(mapper);
    private final TransactionJson json = new TransactionJson(mapper, codec);
    private final HeaderPolicy headerPolicy = new DefaultHeaderPolicy(DefaultHeaderPolicyTest.HEADERS, CachePolicy.PERMISSIVE);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final RelayMetrics metrics = new RelayMetrics(registry);

    @BeforeEach
    void setUp() throws Exception {
        backend = new MockWebServer();
        backend.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        backend.shutdown();
    }

    private FolderQueue queue() {
        FolderQueue queue = new FolderQueue("dev", RouteFolders.under(base, "dev"), new AtomicRenameClaim(), json);
        queue.ensureDirectories();
        return queue;
    }

    private TransactionProcessor processor(FolderQueue queue, String backendUrl, HttpClientGateway gateway) {
        RelayRoutes routes = new RelayRoutes(List.of(new RouteBinding("dev", backendUrl, queue, gateway)));
        ForwardingService forwarding = new LoggingForwardingService(new ForwardingServiceImpl(routes, metrics));
        return new TransactionProcessor(routes, forwarding, headerPolicy, codec, metrics, Clock.systemUTC());
    }

    private static WebClientHttpClient directClient() {
        return new WebClientHttpClient(WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(false)))
                .build());
    }

    private EncodedRequest submit(FolderQueue queue, String method, String path, String query, byte[] body) {
        HttpHeaders headers = new HttpHeaders();
        headers.add("Content-Type", "application/json");
        headers.add("User-Agent", "test");
        headers.add("X-Trace", "t-1");
        CanonicalRequestEncoder encoder = new CanonicalRequestEncoder(headerPolicy, codec, json, Clock.systemUTC());
        EncodedRequest encoded = encoder.encode(new InboundRequest(method, "dev", path, query, headers, body));
        queue.submit(encoded.name(), encoded.record());
        assertThat(queue.claim(encoded.name())).isTrue();
        return encoded;
    }

    @Test
    void get_items_records_json_response_and_clears_inbox() throws Exception {
        backend.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"items\":[]}"));
        FolderQueue queue = queue();
        EncodedRequest encoded = submit(queue, "GET", "items", "", new byte[0]);

        ProcessingResult result = processor(queue, backend.url("/").toString(), directClient()).process("dev", encoded.name());

        RecordedRequest seen = backend.takeRequest(5, TimeUnit.SECONDS);
        assertThat(seen.getPath()).isEqualTo("/items");
        assertThat(seen.getHeader("X-Trace")).isEqualTo("t-1");
        assertThat(seen.getHeader("User-Agent")).isNotEqualTo("test");

        assertThat(result).isInstanceOf(ProcessingResult.Completed.class);
        assertThat(queue.inboxExists(encoded.name())).isFalse();

        JsonNode sent = mapper.readTree(Files.readAllBytes(base.resolve("dev/sent/" + encoded.name() + ".json")));
        assertThat(sent.get("response").get("status_code").asInt()).isEqualTo(200);
        assertThat(sent.get("response").get("type").asText()).isEqualTo("json");
        assertThat(sent.get("response").get("payload")).isEqualTo(mapper.readTree("{\"items\":[]}"));
        assertThat(sent.get("stats").has("elapsed_request")).isTrue();
        assertThat(sent.get("stats").has("elapsed_total")).isTrue();
        assertThat(registry.find("relay_transactions_total").tag("outcome", "completed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void body_and_query_are_forwarded() throws Exception {
        backend.enqueue(new MockResponse().setResponseCode(201).setBody("created"));
        FolderQueue queue = queue();
        EncodedRequest encoded = submit(queue, "POST", "orders/new", "dry=1",
                "{\"sku\":\"A1\"}".getBytes(StandardCharsets.UTF_8));

        ProcessingResult result = processor(queue, backend.url("/api/").toString(), directClient()).process("dev", encoded.name());

        RecordedRequest seen = backend.takeRequest(5, TimeUnit.SECONDS);
        assertThat(seen.getMethod()).isEqualTo("POST");
        assertThat(seen.getPath()).isEqualTo("/api/orders/new?dry=1");
        assertThat(seen.getBody().readUtf8()).isEqualTo("{\"sku\":\"A1\"}");
        assertThat(((ProcessingResult.Completed) result).response().statusCode()).isEqualTo(201);
    }

    @Test
    void backend_error_status_is_a_completed_transaction() {
        backend.enqueue(new MockResponse().setResponseCode(503).setBody("down"));
        FolderQueue queue = queue();
        EncodedRequest encoded = submit(queue, "GET", "items", "", new byte[0]);

        ProcessingResult result = processor(queue, backend.url("/").toString(), directClient()).process("dev", encoded.name());

        assertThat(((ProcessingResult.Completed) result).response().statusCode()).isEqualTo(503);
    }

    @Test
    void unreachable_backend_writes_error_sentinel_and_clears_inbox() throws Exception {
        FolderQueue queue = queue();
        EncodedRequest encoded = submit(queue, "GET", "items", "", new byte[0]);

        ProcessingResult result = processor(queue, "http://127.0.0.1:1", directClient()).process("dev", encoded.name());

        assertThat(result).isInstanceOf(ProcessingResult.Failed.class);
        assertThat(((ProcessingResult.Failed) result).reason()).startsWith("Cannot reach http://127.0.0.1:1/items");
        assertThat(queue.inboxExists(encoded.name())).isFalse();
        JsonNode sent = mapper.readTree(Files.readAllBytes(base.resolve("dev/sent/" + encoded.name() + ".json")));
        assertThat(sent.has("error")).isTrue();
        assertThat(sent.has("response")).isFalse();
        assertThat(sent.size()).isEqualTo(1);
        assertThat(registry.find("relay_transactions_total").tag("outcome", "failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unreadable_inbox_record_fails_the_transaction() throws Exception {
        FolderQueue queue = queue();
        Files.writeString(base.resolve("dev/inbox/broken_1.json"), "not json");

        ProcessingResult result = processor(queue, backend.url("/").toString(), directClient()).process("dev", "broken_1");

        assertThat(result).isInstanceOf(ProcessingResult.Failed.class);
        assertThat(queue.inboxExists("broken_1")).isFalse();
        assertThat(queue.lookupSent("broken_1")).contains(result);
    }
}
