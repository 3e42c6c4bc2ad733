package com.filerelay.proxy.config;

import com.filerelay.proxy.metrics.RelayMetrics;
import com.filerelay.proxy.web.filter.SubmissionRateLimitFilter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimitConfig {

    @Bean
    @ConditionalOnExpression("${relay.client.submissions-per-minute:0} > 0")
    public SubmissionRateLimitFilter submissionRateLimitFilter(RelayProperties props, RelayMetrics metrics) {
        return new SubmissionRateLimitFilter(props.client().submissionsPerMinute(), props.routes().keySet(), metrics);
    }
}
