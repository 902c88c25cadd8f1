package com.pathtopology.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the elevation API.
 *
 * Timeouts are short on purpose: a segment write holds its transaction open
 * while the heights are fetched.
 */
@Configuration
public class ElevationClientConfig {

    @Value("${topology.elevation.connect-timeout-ms:2000}")
    private long connectTimeoutMs;

    @Value("${topology.elevation.read-timeout-ms:5000}")
    private long readTimeoutMs;

    @Bean
    public RestTemplate elevationRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
            .setReadTimeout(Duration.ofMillis(readTimeoutMs))
            .build();
    }
}
