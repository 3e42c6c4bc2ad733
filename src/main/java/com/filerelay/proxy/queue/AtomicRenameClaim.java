package com.filerelay.proxy.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Claims a draft by renaming it into the inbox. Only as exclusive as the underlying store's
 * rename: synchronized folders (cloud drives) may let two watchers both succeed.
 */
public class AtomicRenameClaim implements ClaimStrategy {

    private static final Logger log = LoggerFactory.getLogger(AtomicRenameClaim.class);

    @Override
    public boolean claim(Path draft, Path inbox) throws IOException {
        try {
            move(draft, inbox);
            return true;
        } catch (NoSuchFileException e) {
            log.debug("draft {} already claimed", draft.getFileName());
            return false;
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("atomic move unsupported for {}, falling back to plain move", source);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
