package com.filerelay.proxy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "relay.forwarding")
public record ForwardingFeaturesProperties(
        @DefaultValue("true") boolean loggingEnabled,
        @DefaultValue Resilience resilience
) {
    public record Resilience(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("relayBackend") String instanceName
    ) {
    }
}
