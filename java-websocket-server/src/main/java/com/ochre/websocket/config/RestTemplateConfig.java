package com.ochre.websocket.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate Configuration for the agent service.
 *
 * The read timeout bounds the gap between two streamed lines, not the
 * whole run.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate agentRestTemplate(
            @Value("${agent.service.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${agent.service.read-timeout-ms:300000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }
}
