package com.filerelay.proxy.config;

import com.filerelay.proxy.domain.CachePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
        @DefaultValue("client") Mode mode,
        @NotNull Path base,
        @DefaultValue("permissive") CachePolicy cachePolicy,
        Map<String, @Valid Route> routes,
        Path defaultCommandTemplate,
        @Valid @DefaultValue Headers headers,
        @Valid @DefaultValue Client client,
        @Valid @DefaultValue Server server
) {

    public enum Mode { CLIENT, SERVER }

    public RelayProperties {
        base = expandHome(base);
        defaultCommandTemplate = expandHome(defaultCommandTemplate);
        routes = routes == null ? Map.of() : Map.copyOf(routes);
    }

    /** A logical environment: one backend, one folder triple. */
    public record Route(
            @NotBlank String backend,   // base URL, no trailing path needed
            Path commandTemplate        // optional; enables the command strategy
    ) {
        public Route {
            commandTemplate = expandHome(commandTemplate);
        }
    }

    static Path expandHome(Path path) {
        if (path == null || !path.startsWith("~")) {
            return path;
        }
        Path home = Path.of(System.getProperty("user.home"));
        return path.getNameCount() == 1 ? home : home.resolve(path.subpath(1, path.getNameCount()));
    }

    /** Header allowlists; names are compared case-insensitively. */
    public record Headers(
            @DefaultValue("content-type") List<String> hash,
            @DefaultValue({"authorization", "xproxy-api-key", "api-key"}) List<String> hashStrict,
            @DefaultValue({"content-type", "authorization"}) List<String> pass,
            @DefaultValue({"x-", "xproxy-"}) List<String> reservedPrefixes
    ) {}

    public record Client(
            @DefaultValue("500ms") Duration pollInterval,
            Duration waitTimeout,                       // unset: wait forever
            @Min(0) @DefaultValue("0") int submissionsPerMinute
    ) {}

    public record Server(
            @DefaultValue("1s") Duration scanInterval
    ) {}
}
