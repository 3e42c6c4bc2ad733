package com.filerelay.proxy.application;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class RelayRoutes {

    private final Map<String, RouteBinding> routes;

    public RelayRoutes(List<RouteBinding> bindings) {
        Map<String, RouteBinding> byName = new LinkedHashMap<>();
        bindings.forEach(b -> byName.put(b.name(), b));
        this.routes = Collections.unmodifiableMap(byName);
    }

    public Optional<RouteBinding> find(String route) {
        return Optional.ofNullable(routes.get(route));
    }

    public RouteBinding get(String route) {
        return find(route).orElseThrow(() -> new IllegalArgumentException("unknown route " + route));
    }

    public Collection<RouteBinding> all() {
        return routes.values();
    }
}
