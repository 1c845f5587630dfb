package com.ruleflow.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Outbound HTTP client used by field mutations and webhook actions.
 * Every call is bounded by the configured connect and read timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, RuleflowProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getHttp().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getHttp().getReadTimeoutMs()))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
