package com.filerelay.proxy.application;

import com.filerelay.proxy.codec.DataCodec;
import com.filerelay.proxy.codec.IdentityNames;
import com.filerelay.proxy.codec.TransactionJson;
import com.filerelay.proxy.domain.EncodedRequest;
import com.filerelay.proxy.domain.InboundRequest;
import com.filerelay.proxy.domain.Payload;
import com.filerelay.proxy.domain.TransactionRecord;
import com.filerelay.proxy.domain.TransactionStats;

import java.time.Clock;
import java.util.Map;

/**
 * Turns an inbound request into a draft transaction and its identity name.
 * <p>
 * The name only depends on method, path, query string, route, identity headers and body, so
 * repeating a request with other volatile headers maps onto the same transaction.
 */
public class CanonicalRequestEncoder {

    private final HeaderPolicy headerPolicy;
    private final DataCodec codec;
    private final TransactionJson json;
    private final Clock clock;

    public CanonicalRequestEncoder(HeaderPolicy headerPolicy, DataCodec codec, TransactionJson json, Clock clock) {
        this.headerPolicy = headerPolicy;
        this.codec = codec;
        this.json = json;
        this.clock = clock;
    }

    public EncodedRequest encode(InboundRequest in) {
        Map<String, String> identityHeaders = headerPolicy.forIdentity(in.headers());
        Payload payload = codec.encode(in.body());
        TransactionRecord record = new TransactionRecord(
                in.method(),
                in.path(),
                in.queryString() == null ? "" : in.queryString(),
                in.route(),
                identityHeaders,
                payload,
                TransactionStats.created(clock.instant()),
                headerPolicy.original(in.headers()),
                headerPolicy.forServer(in.headers()),
                null);
        String name = IdentityNames.of(record.path(), json.canonicalIdentity(record));
        return new EncodedRequest(name, record);
    }
}
