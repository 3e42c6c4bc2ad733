package com.filerelay.proxy.application;

import com.filerelay.proxy.domain.CachePolicy;
import com.filerelay.proxy.domain.ProcessingResult;
import com.filerelay.proxy.domain.RelayedResponse;
import com.filerelay.proxy.queue.FolderQueue;

import java.util.Optional;

/**
 * Decides whether a finished transaction in the sent folder can answer a repeated request.
 * Error sentinels are never replayed.
 */
public class CacheResolver {

    private final CachePolicy policy;

    public CacheResolver(CachePolicy policy) {
        this.policy = policy;
    }

    public Optional<RelayedResponse> resolve(FolderQueue queue, String name, String method) {
        return queue.lookupSent(name)
                .filter(ProcessingResult.Completed.class::isInstance)
                .map(r -> ((ProcessingResult.Completed) r).response())
                .filter(response -> policy.permitsReplay(method, response.statusCode()));
    }
}
