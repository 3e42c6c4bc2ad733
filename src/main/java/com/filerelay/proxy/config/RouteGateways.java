package com.filerelay.proxy.config;

import com.filerelay.proxy.infrastructure.command.CommandTemplateGateway;
import com.filerelay.proxy.infrastructure.http.HttpClientGateway;
import com.filerelay.proxy.infrastructure.http.ResilientHttpClientGateway;

import java.util.Map;

/**
 * The forwarding strategy chosen for each configured route.
 */
public class RouteGateways {

    private final Map<String, HttpClientGateway> byRoute;

    public RouteGateways(Map<String, HttpClientGateway> byRoute) {
        this.byRoute = Map.copyOf(byRoute);
    }

    public HttpClientGateway gatewayFor(String route) {
        HttpClientGateway gateway = byRoute.get(route);
        if (gateway == null) {
            throw new IllegalStateException("no gateway for route " + route);
        }
        return gateway;
    }

    String describe(String route) {
        HttpClientGateway gateway = gatewayFor(route);
        if (gateway instanceof CommandTemplateGateway) return "command-template";
        if (gateway instanceof ResilientHttpClientGateway resilient) return "direct (resilient: " + resilient.name() + ")";
        return "direct";
    }
}
