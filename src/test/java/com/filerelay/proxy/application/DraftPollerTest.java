package com.filerelay.proxy.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.filerelay.proxy.codec.DataCodec;
import com.filerelay.proxy.codec.TransactionJson;
import com.filerelay.proxy.domain.Payload;
import com.filerelay.proxy.domain.TransactionRecord;
import com.filerelay.proxy.domain.TransactionStats;
import com.filerelay.proxy.infrastructure.http.HttpClientGateway;
import com.filerelay.proxy.queue.AtomicRenameClaim;
import com.filerelay.proxy.queue.ClaimStrategy;
import com.filerelay.proxy.queue.FolderQueue;
import com.filerelay.proxy.queue.RouteFolders;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DraftPollerTest {

    @TempDir
    Path base;

    private final ObjectMapper mapper = new ObjectMapper();
    private final TransactionJson json = new TransactionJson(mapper, new DataCodec(mapper));
    private final TransactionProcessor processor = mock(TransactionProcessor.class);
    private final HttpClientGateway gateway = mock(HttpClientGateway.class);

    private FolderQueue queue(String route, ClaimStrategy claims) {
        FolderQueue queue = new FolderQueue(route, RouteFolders.under(base, route), claims, json);
        queue.ensureDirectories();
        return queue;
    }

    private static TransactionRecord record(String route) {
        return new TransactionRecord("GET", "items", "", route, Map.of(), Payload.empty(),
                TransactionStats.none(), Map.of(), Map.of(), null);
    }

    @Test
    void claims_and_processes_drafts_of_every_route() {
        FolderQueue dev = queue("dev", new AtomicRenameClaim());
        FolderQueue prod = queue("prod", new AtomicRenameClaim());
        dev.submit("a_1", record("dev"));
        dev.submit("b_2", record("dev"));
        prod.submit("c_3", record("prod"));
        DraftPoller poller = new DraftPoller(new RelayRoutes(List.of(
                new RouteBinding("dev", "http://dev", dev, gateway),
                new RouteBinding("prod", "http://prod", prod, gateway))), processor);

        assertThat(poller.scanOnce()).isEqualTo(3);

        verify(processor).process("dev", "a_1");
        verify(processor).process("dev", "b_2");
        verify(processor).process("prod", "c_3");
        assertThat(dev.inboxExists("a_1")).isTrue();
        assertThat(dev.pendingDrafts()).isEmpty();
    }

    @Test
    void lost_claim_race_is_skipped() {
        ClaimStrategy lost = (draft, inbox) -> false;
        FolderQueue dev = queue("dev", lost);
        dev.submit("a_1", record("dev"));
        DraftPoller poller = new DraftPoller(new RelayRoutes(List.of(
                new RouteBinding("dev", "http://dev", dev, gateway))), processor);

        assertThat(poller.scanOnce()).isZero();

        verify(processor, never()).process(anyString(), anyString());
    }

    @Test
    void storage_error_on_one_draft_does_not_stop_the_scan() {
        FolderQueue dev = queue("dev", new AtomicRenameClaim());
        dev.submit("a_1", record("dev"));
        dev.submit("b_2", record("dev"));
        doThrow(new UncheckedIOException(new IOException("disk full"))).when(processor).process("dev", "a_1");
        DraftPoller poller = new DraftPoller(new RelayRoutes(List.of(
                new RouteBinding("dev", "http://dev", dev, gateway))), processor);

        assertThat(poller.scanOnce()).isEqualTo(1);

        verify(processor).process(eq("dev"), eq("b_2"));
    }
}
