package com.social.tipping.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.UUID;

/**
 * One RestTemplate per collaborator, each with its own base URL and timeouts.
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public RestTemplate settlementRestTemplate(RestTemplateBuilder builder, CollaboratorConfig config) {
        return build(builder, "settlement", config.getSettlement());
    }

    @Bean
    public RestTemplate messageVaultRestTemplate(RestTemplateBuilder builder, CollaboratorConfig config) {
        return build(builder, "message-vault", config.getMessageVault());
    }

    @Bean
    public RestTemplate moderationRestTemplate(RestTemplateBuilder builder, CollaboratorConfig config) {
        return build(builder, "moderation", config.getModeration());
    }

    @Bean
    public RestTemplate userDirectoryRestTemplate(RestTemplateBuilder builder, CollaboratorConfig config) {
        return build(builder, "user-directory", config.getUserDirectory());
    }

    private RestTemplate build(RestTemplateBuilder builder, String name, CollaboratorConfig.Endpoint endpoint) {
        log.info("HTTP collaborator '{}' at {} (connect {}ms, read {}ms)",
                name, endpoint.getBaseUrl(), endpoint.getConnectTimeoutMs(), endpoint.getReadTimeoutMs());
        return builder
                .rootUri(endpoint.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(endpoint.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(endpoint.getReadTimeoutMs()))
                .additionalInterceptors(requestIdInterceptor())
                .build();
    }

    private ClientHttpRequestInterceptor requestIdInterceptor() {
        return (request, body, execution) -> {
            if (!request.getHeaders().containsKey("X-Request-ID")) {
                request.getHeaders().add("X-Request-ID", UUID.randomUUID().toString());
            }
            request.getHeaders().add("X-Service-Name", "tip-pipeline");
            return execution.execute(request, body);
        };
    }
}
