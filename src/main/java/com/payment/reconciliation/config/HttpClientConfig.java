package com.payment.reconciliation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for outbound provider and blockchain explorer calls. Every call
 * carries a bounded connect and read timeout.
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean(name = "providerRestTemplate")
    public RestTemplate providerRestTemplate(
            @Value("${payment.providers.http.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${payment.providers.http.read-timeout-ms:30000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        log.info("Provider HTTP client: connectTimeoutMs={} readTimeoutMs={}", connectTimeoutMs, readTimeoutMs);
        return new RestTemplate(factory);
    }
}
