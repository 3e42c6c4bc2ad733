package com.filerelay.proxy.application;

import com.filerelay.proxy.domain.ProcessingResult;
import com.filerelay.proxy.queue.FolderQueue;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Client side wait for a submitted transaction: first the draft is claimed, then the claim is
 * released, then the result is read from sent. Waiting for the claim to clear keeps a stale
 * sent artifact of the same name from being mistaken for the fresh result.
 */
public class TransactionWaiter {

    private final Duration pollInterval;
    private final Duration timeout;
    private final Scheduler scheduler;

    public TransactionWaiter(Duration pollInterval, Duration timeout) {
        this(pollInterval, timeout, Schedulers.boundedElastic());
    }

    TransactionWaiter(Duration pollInterval, Duration timeout, Scheduler scheduler) {
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    /**
     * Completes with the transaction's outcome; errors with {@link java.util.concurrent.TimeoutException}
     * only when a wait timeout is configured.
     */
    public Mono<ProcessingResult> await(FolderQueue queue, String name) {
        Mono<ProcessingResult> result = until(() -> !queue.draftExists(name))
                .then(until(() -> !queue.inboxExists(name)))
                .then(poll(Mono.fromCallable(() -> queue.lookupSent(name).orElse(null))))
                .subscribeOn(scheduler);
        return timeout == null ? result : result.timeout(timeout);
    }

    private Mono<Void> until(BooleanSupplier condition) {
        return poll(Mono.fromCallable(condition::getAsBoolean).filter(Boolean::booleanValue)).then();
    }

    private <T> Mono<T> poll(Mono<T> check) {
        return check.repeatWhenEmpty(attempts -> attempts.delayElements(pollInterval, scheduler));
    }
}
