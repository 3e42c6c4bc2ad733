package com.filerelay.proxy.config;

import com.filerelay.proxy.application.ForwardingService;
import com.filerelay.proxy.application.LoggingForwardingService;
import com.filerelay.proxy.infrastructure.command.CommandTemplate;
import com.filerelay.proxy.infrastructure.command.CommandTemplateGateway;
import com.filerelay.proxy.infrastructure.command.ShellCommandRunner;
import com.filerelay.proxy.infrastructure.http.HttpClientGateway;
import com.filerelay.proxy.infrastructure.http.ResilientHttpClientGateway;
import com.filerelay.proxy.infrastructure.http.WebClientHttpClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.*;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

@Configuration
public class ForwardingConfig {

    private static final int MAX_BODY_BYTES = 64 * 1024 * 1024;

    @Bean
    public WebClient relayWebClient(WebClient.Builder builder) {
        return builder
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(false)))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                .build();
    }

    @Bean
    public WebClientHttpClient webClientHttpClient(WebClient relayWebClient) {
        return new WebClientHttpClient(relayWebClient);
    }

    @Bean
    public ShellCommandRunner shellCommandRunner() {
        return new ShellCommandRunner();
    }

    @Bean
    public RouteGateways routeGateways(
            RelayProperties props,
            ForwardingFeaturesProperties features,
            WebClientHttpClient direct,
            ShellCommandRunner runner,
            ObjectProvider<CircuitBreakerRegistry> cbRegistry,
            ObjectProvider<TimeLimiterRegistry> tlRegistry
    ) {
        Map<String, HttpClientGateway> gateways = new HashMap<>();
        props.routes().forEach((name, route) -> {
            Path template = route.commandTemplate() != null ? route.commandTemplate() : props.defaultCommandTemplate();
            if (template != null) {
                gateways.put(name, new CommandTemplateGateway(loadTemplate(name, template), runner));
            } else if (features.resilience().enabled()) {
                var config = features.resilience().instanceName();
                gateways.put(name, new ResilientHttpClientGateway(
                        direct,
                        cbRegistry.getObject().circuitBreaker(name, config),
                        tlRegistry.getObject().timeLimiter(name, config)
                ));
            } else {
                gateways.put(name, direct);
            }
        });
        return new RouteGateways(gateways);
    }

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "relay.forwarding", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public ForwardingService loggingForwardingService(@Qualifier("forwardingCore") ForwardingService core) {
        return new LoggingForwardingService(core);
    }

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "relay.forwarding", name = "logging-enabled", havingValue = "false")
    public ForwardingService primaryCoreForwarding(@Qualifier("forwardingCore") ForwardingService core) {
        return core;
    }

    private static CommandTemplate loadTemplate(String route, Path file) {
        try {
            return CommandTemplate.load(file);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read command template " + file + " for route " + route, e);
        }
    }
}
