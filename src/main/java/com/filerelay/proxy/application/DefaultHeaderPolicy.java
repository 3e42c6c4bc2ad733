package com.filerelay.proxy.application;

import com.filerelay.proxy.config.RelayProperties;
import com.filerelay.proxy.domain.CachePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Allowlist based header selection. The strict hash set only applies under
 * {@link CachePolicy#STRICT}; reserved prefixes are always hashed and always forwarded.
 */
public class DefaultHeaderPolicy implements HeaderPolicy {

    private static final Logger log = LoggerFactory.getLogger(DefaultHeaderPolicy.class);

    private static final List<String> HOP_BY_HOP = List.of(
            HttpHeaders.CONNECTION, HttpHeaders.TRANSFER_ENCODING, "Keep-Alive",
            HttpHeaders.PROXY_AUTHENTICATE, HttpHeaders.PROXY_AUTHORIZATION,
            HttpHeaders.TE, HttpHeaders.TRAILER, HttpHeaders.UPGRADE);

    private final Set<String> hash;
    private final Set<String> pass;
    private final List<String> prefixes;

    public DefaultHeaderPolicy(RelayProperties.Headers config, CachePolicy cachePolicy) {
        Set<String> active = lower(config.hash());
        if (cachePolicy == CachePolicy.STRICT) {
            active.addAll(lower(config.hashStrict()));
        }
        this.hash = Set.copyOf(active);
        this.pass = Set.copyOf(lower(config.pass()));
        this.prefixes = List.copyOf(lower(config.reservedPrefixes()));
    }

    @Override
    public Map<String, String> forIdentity(HttpHeaders inbound) {
        Map<String, String> out = new TreeMap<>();
        inbound.forEach((name, values) -> {
            String key = name.toLowerCase(Locale.ROOT);
            if (hash.contains(key) || reserved(key)) {
                out.put(key, String.join(", ", values));
            } else {
                log.trace("header {} not part of identity", name);
            }
        });
        return out;
    }

    @Override
    public Map<String, String> forServer(HttpHeaders inbound) {
        return select(inbound, key -> pass.contains(key) || reserved(key));
    }

    @Override
    public Map<String, String> original(HttpHeaders inbound) {
        return select(inbound, key -> true);
    }

    @Override
    public HttpHeaders toBackend(Map<String, String> serverHeaders) {
        HttpHeaders out = new HttpHeaders();
        serverHeaders.forEach(out::add);
        out.remove(HttpHeaders.HOST);
        out.remove(HttpHeaders.CONTENT_LENGTH);
        return out;
    }

    @Override
    public HttpHeaders toClient(Map<String, String> relayed) {
        HttpHeaders out = new HttpHeaders();
        if (relayed != null) {
            relayed.forEach(out::add);
        }
        HOP_BY_HOP.forEach(out::remove);
        // the stored body is already decoded and may be re-serialized
        out.remove(HttpHeaders.CONTENT_ENCODING);
        out.remove(HttpHeaders.CONTENT_LENGTH);
        return out;
    }

    private boolean reserved(String lowerName) {
        for (String prefix : prefixes) {
            if (lowerName.startsWith(prefix)) return true;
        }
        return false;
    }

    private static Map<String, String> select(HttpHeaders inbound, Predicate<String> keep) {
        Map<String, String> out = new LinkedHashMap<>();
        inbound.forEach((name, values) -> {
            if (keep.test(name.toLowerCase(Locale.ROOT))) {
                out.put(name, String.join(", ", values));
            }
        });
        return out;
    }

    private static Set<String> lower(List<String> names) {
        return names.stream()
                .map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(HashSet::new));
    }
}
