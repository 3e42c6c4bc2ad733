package com.filerelay.proxy.config;

import com.filerelay.proxy.application.CacheResolver;
import com.filerelay.proxy.application.CanonicalRequestEncoder;
import com.filerelay.proxy.application.DefaultHeaderPolicy;
import com.filerelay.proxy.application.ForwardingService;
import com.filerelay.proxy.application.HeaderPolicy;
import com.filerelay.proxy.application.RelayRoutes;
import com.filerelay.proxy.application.RouteBinding;
import com.filerelay.proxy.application.TransactionProcessor;
import com.filerelay.proxy.application.TransactionWaiter;
import com.filerelay.proxy.codec.DataCodec;
import com.filerelay.proxy.codec.TransactionJson;
import com.filerelay.proxy.metrics.RelayMetrics;
import com.filerelay.proxy.queue.AtomicRenameClaim;
import com.filerelay.proxy.queue.ClaimStrategy;
import com.filerelay.proxy.queue.FolderQueue;
import com.filerelay.proxy.queue.RouteFolders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Configuration
@EnableConfigurationProperties({RelayProperties.class, ForwardingFeaturesProperties.class})
public class RelayConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClaimStrategy claimStrategy() {
        return new AtomicRenameClaim();
    }

    @Bean
    public HeaderPolicy headerPolicy(RelayProperties props) {
        return new DefaultHeaderPolicy(props.headers(), props.cachePolicy());
    }

    @Bean
    public CanonicalRequestEncoder canonicalRequestEncoder(HeaderPolicy headerPolicy, DataCodec codec,
                                                           TransactionJson json, Clock clock) {
        return new CanonicalRequestEncoder(headerPolicy, codec, json, clock);
    }

    @Bean
    public CacheResolver cacheResolver(RelayProperties props) {
        return new CacheResolver(props.cachePolicy());
    }

    @Bean
    public TransactionWaiter transactionWaiter(RelayProperties props) {
        return new TransactionWaiter(props.client().pollInterval(), props.client().waitTimeout());
    }

    @Bean
    public RelayRoutes relayRoutes(RelayProperties props, ClaimStrategy claims, TransactionJson json,
                                   RouteGateways gateways) {
        List<RouteBinding> bindings = new ArrayList<>();
        Map<String, RelayProperties.Route> sorted = new TreeMap<>(props.routes());
        sorted.forEach((name, route) -> {
            FolderQueue queue = new FolderQueue(name, RouteFolders.under(props.base(), name), claims, json);
            queue.ensureDirectories();
            bindings.add(new RouteBinding(name, route.backend(), queue, gateways.gatewayFor(name)));
            log.info("route {}: drafts={}, inbox={}, sent={}, backend={}, strategy={}", name,
                    queue.folders().drafts(), queue.folders().inbox(), queue.folders().sent(),
                    route.backend(), gateways.describe(name));
        });
        if (bindings.isEmpty()) {
            log.warn("no relay routes configured under relay.routes");
        }
        return new RelayRoutes(bindings);
    }

    @Bean
    public TransactionProcessor transactionProcessor(RelayRoutes routes, ForwardingService forwarding,
                                                     HeaderPolicy headerPolicy, DataCodec codec,
                                                     RelayMetrics metrics, Clock clock) {
        return new TransactionProcessor(routes, forwarding, headerPolicy, codec, metrics, clock);
    }
}
