package com.filerelay.proxy.application;

import org.springframework.http.HttpHeaders;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Copies of header sets that are safe to log.
 */
public final class HeaderMasking {

    private static final Set<String> SECRET = Set.of("authorization", "proxy-authorization", "xproxy-api-key", "api-key");

    private HeaderMasking() {}

    public static Map<String, String> mask(HttpHeaders src) {
        Map<String, String> safe = new LinkedHashMap<>();
        src.forEach((k, v) -> safe.put(k, secret(k) ? "***" : String.join(",", v)));
        return safe;
    }

    public static Map<String, String> mask(Map<String, String> src) {
        Map<String, String> safe = new LinkedHashMap<>();
        src.forEach((k, v) -> safe.put(k, secret(k) ? "***" : v));
        return safe;
    }

    private static boolean secret(String name) {
        return SECRET.contains(name.toLowerCase());
    }
}
