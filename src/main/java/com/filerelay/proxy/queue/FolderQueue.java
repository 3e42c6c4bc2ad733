package com.filerelay.proxy.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.filerelay.proxy.codec.IdentityNames;
import com.filerelay.proxy.codec.TransactionJson;
import com.filerelay.proxy.domain.ProcessingResult;
import com.filerelay.proxy.domain.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The draft → inbox → sent queue of one route.
 * <p>
 * A transaction name lives in drafts until a processor claims it, in inbox while it is being
 * forwarded, and in sent once finished. Documents are written to a hidden temporary file and
 * renamed into place, so a reader never observes a partially written transaction.
 * Storage failures surface as {@link UncheckedIOException}.
 */
public class FolderQueue {

    private static final Logger log = LoggerFactory.getLogger(FolderQueue.class);

    private final String route;
    private final RouteFolders folders;
    private final ClaimStrategy claims;
    private final TransactionJson json;

    public FolderQueue(String route, RouteFolders folders, ClaimStrategy claims, TransactionJson json) {
        this.route = route;
        this.folders = folders;
        this.claims = claims;
        this.json = json;
    }

    public RouteFolders folders() {
        return folders;
    }

    public void ensureDirectories() {
        try {
            Files.createDirectories(folders.drafts());
            Files.createDirectories(folders.inbox());
            Files.createDirectories(folders.sent());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create folders for route " + route, e);
        }
    }

    public void submit(String name, TransactionRecord record) {
        writeAtomically(draft(name), json.write(record));
        log.debug("[{}] submitted {}", route, name);
    }

    /**
     * Moves a draft into the inbox.
     *
     * @return {@code false} if the draft was already gone
     */
    public boolean claim(String name) {
        try {
            Files.createDirectories(folders.inbox());
            return claims.claim(draft(name), inbox(name));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot claim " + name, e);
        }
    }

    public TransactionRecord readClaimed(String name) throws IOException {
        return json.readRecord(Files.readAllBytes(inbox(name)));
    }

    /**
     * Persists the outcome to sent, then removes the inbox artifact even if the write failed.
     */
    public void complete(String name, ProcessingResult result) {
        try {
            writeAtomically(sent(name), json.write(result));
        } finally {
            try {
                if (Files.deleteIfExists(inbox(name))) {
                    log.debug("[{}] cleared {} from inbox", route, name);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("cannot clear inbox artifact " + name, e);
            }
        }
    }

    public Optional<ProcessingResult> lookupSent(String name) {
        Path file = sent(name);
        try {
            return Optional.of(json.readResult(Files.readAllBytes(file)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            // a synchronizing store may expose the file before its content has fully arrived
            log.warn("[{}] unreadable sent artifact {}: {}", route, name, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read sent artifact " + name, e);
        }
    }

    public boolean draftExists(String name) {
        return Files.exists(draft(name));
    }

    public boolean inboxExists(String name) {
        return Files.exists(inbox(name));
    }

    public boolean sentExists(String name) {
        return Files.exists(sent(name));
    }

    /** Names of the drafts currently waiting, in name order. */
    public List<String> pendingDrafts() {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folders.drafts(), "*" + IdentityNames.EXTENSION)) {
            for (Path p : stream) {
                IdentityNames.fromFileName(p.getFileName().toString()).ifPresent(names::add);
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list drafts of route " + route, e);
        }
        Collections.sort(names);
        return names;
    }

    Path draft(String name) {
        return folders.drafts().resolve(IdentityNames.fileName(name));
    }

    Path inbox(String name) {
        return folders.inbox().resolve(IdentityNames.fileName(name));
    }

    Path sent(String name) {
        return folders.sent().resolve(IdentityNames.fileName(name));
    }

    private static void writeAtomically(Path target, byte[] content) {
        Path dir = target.getParent();
        Path tmp = dir.resolve("." + target.getFileName() + ".tmp");
        try {
            Files.createDirectories(dir);
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write " + target, e);
        }
    }
}
