package com.relay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient used by every provider adapter.
 */
@Configuration
public class WebClientConfiguration {

    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    private final RelayProperties properties;

    public WebClientConfiguration(RelayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        // Response timeout bounds buffered calls; streams are bounded per request by the router
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getProxy().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}
