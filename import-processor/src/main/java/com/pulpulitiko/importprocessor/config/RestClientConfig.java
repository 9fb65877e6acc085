package com.pulpulitiko.importprocessor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * Short connect and read timeouts for every downstream {@code RestClient}.
 * Callers decide whether to retry; the clients never do.
 */
@Slf4j
@Configuration
public class RestClientConfig {

    @Value("${downstream.connect-timeout:2s}")
    private Duration connectTimeout;

    @Value("${downstream.read-timeout:5s}")
    private Duration readTimeout;

    @Bean
    public RestClientCustomizer downstreamTimeoutCustomizer() {
        log.info("Downstream RestClient timeouts: connect={}, read={}", connectTimeout, readTimeout);
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(connectTimeout);
            factory.setReadTimeout(readTimeout);
            builder.requestFactory(factory);
        };
    }
}
