package com.filerelay.proxy.domain;

import java.util.Map;

/**
 * One relayed request, and once processed, its response.
 * <p>
 * {@code method}, {@code path}, {@code queryString}, {@code folder}, {@code headers} and
 * {@code payload} make up the identity of the transaction and never change after encoding.
 */
public record TransactionRecord(
        String method,
        String path,
        String queryString,
        String folder,
        Map<String, String> headers,
        Payload payload,
        TransactionStats stats,
        Map<String, String> originalHeaders,
        Map<String, String> serverHeaders,
        RelayedResponse response
) {

    public TransactionRecord withResponse(RelayedResponse response, TransactionStats stats) {
        return new TransactionRecord(method, path, queryString, folder, headers, payload,
                stats, originalHeaders, serverHeaders, response);
    }
}
