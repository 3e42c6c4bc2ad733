package com.filerelay.proxy.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Timestamps and durations attached to a transaction as it moves through the queue.
 * Durations are in seconds; any field may be absent.
 */
public record TransactionStats(
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Double elapsedRequest,
        Double elapsedTotal
) {

    public static TransactionStats created(Instant createdAt) {
        return new TransactionStats(createdAt, null, null, null, null);
    }

    public static TransactionStats none() {
        return new TransactionStats(null, null, null, null, null);
    }

    public TransactionStats finished(Instant started, Instant finished) {
        Double total = createdAt != null ? seconds(createdAt, finished) : null;
        return new TransactionStats(createdAt, started, finished, seconds(started, finished), total);
    }

    private static double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / 1_000_000_000d;
    }
}
