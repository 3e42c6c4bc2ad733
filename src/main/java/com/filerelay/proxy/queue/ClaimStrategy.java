package com.filerelay.proxy.queue;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exclusive hand-over of a draft to one processor.
 * <p>
 * Exactly one concurrent caller may succeed for a given draft. Implementations that cannot rely
 * on the store's rename semantics may substitute a lease or lock record.
 */
public interface ClaimStrategy {

    /**
     * @return {@code false} if the draft no longer exists, i.e. another processor took it
     * @throws IOException when the store refuses the hand-over for any other reason
     */
    boolean claim(Path draft, Path inbox) throws IOException;
}
