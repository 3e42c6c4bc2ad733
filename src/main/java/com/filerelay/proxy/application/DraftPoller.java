package com.filerelay.proxy.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Server loop: claims every waiting draft of every route and processes it.
 * No ordering is kept across routes or drafts, and a storage error on one draft only skips that draft.
 */
public class DraftPoller {

    private static final Logger log = LoggerFactory.getLogger(DraftPoller.class);

    private final RelayRoutes routes;
    private final TransactionProcessor processor;

    public DraftPoller(RelayRoutes routes, TransactionProcessor processor) {
        this.routes = routes;
        this.processor = processor;
    }

    @Scheduled(fixedDelayString = "${relay.server.scan-interval:PT1S}")
    public void scan() {
        int processed = scanOnce();
        if (processed > 0) {
            log.debug("scan processed {} transaction(s)", processed);
        }
    }

    /** @return number of drafts this scan claimed and processed */
    public int scanOnce() {
        int processed = 0;
        for (RouteBinding route : routes.all()) {
            for (String name : route.queue().pendingDrafts()) {
                try {
                    if (!route.queue().claim(name)) {
                        continue;
                    }
                    log.info("[{}] claimed {}", route.name(), name);
                    processor.process(route.name(), name);
                    processed++;
                } catch (RuntimeException e) {
                    log.error("[{}] giving up on {} for this scan", route.name(), name, e);
                }
            }
        }
        return processed;
    }
}
