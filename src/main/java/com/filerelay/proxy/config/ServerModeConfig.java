package com.filerelay.proxy.config;

import com.filerelay.proxy.application.DraftPoller;
import com.filerelay.proxy.application.RelayRoutes;
import com.filerelay.proxy.application.TransactionProcessor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Server role: drains the draft folders of all routes on a fixed delay.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "relay", name = "mode", havingValue = "server")
public class ServerModeConfig {

    @Bean
    public DraftPoller draftPoller(RelayRoutes routes, TransactionProcessor processor) {
        return new DraftPoller(routes, processor);
    }
}
