package com.filerelay.proxy.application;

import org.springframework.http.HttpHeaders;

import java.util.Map;

public interface HeaderPolicy {

    /** Headers that take part in the transaction identity, keyed by lower-case name. */
    Map<String, String> forIdentity(HttpHeaders inbound);

    /** Headers the server side will send to the backend. */
    Map<String, String> forServer(HttpHeaders inbound);

    /** Every inbound header, multi-valued ones joined. */
    Map<String, String> original(HttpHeaders inbound);

    HttpHeaders toBackend(Map<String, String> serverHeaders);

    HttpHeaders toClient(Map<String, String> relayed);
}
