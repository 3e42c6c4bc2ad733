package com.filerelay.proxy.domain;

import java.util.Set;

/**
 * Which sent transactions may be replayed for a repeated request.
 */
public enum CachePolicy {

    /** Any recorded response, errors included. */
    PERMISSIVE,

    /** Only successful GET and POST responses. */
    STRICT;

    private static final Set<String> STRICT_METHODS = Set.of("GET", "POST");

    public boolean permitsReplay(String method, int statusCode) {
        if (this == PERMISSIVE) {
            return true;
        }
        return method != null
                && STRICT_METHODS.contains(method.toUpperCase())
                && statusCode >= 200 && statusCode <= 299;
    }
}
