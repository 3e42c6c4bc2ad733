package com.filerelay.proxy.domain;

import java.util.Objects;

/**
 * Terminal state of a transaction, as written to the sent folder.
 */
public interface ProcessingResult {

    static ProcessingResult completed(TransactionRecord record) {
        return new Completed(record);
    }

    static ProcessingResult failed(String reason) {
        return new Failed(reason);
    }

    record Completed(TransactionRecord record) implements ProcessingResult {
        public Completed {
            Objects.requireNonNull(record, "record");
            if (record.response() == null) {
                throw new IllegalArgumentException("completed transaction needs a response");
            }
        }

        public RelayedResponse response() {
            return record.response();
        }
    }

    record Failed(String reason) implements ProcessingResult {
        public Failed {
            reason = reason != null ? reason : "unknown error";
        }
    }
}
