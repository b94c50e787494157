package com.social.tipping.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Base URLs and timeouts of the HTTP collaborators the pipeline calls.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "collaborators")
public class CollaboratorConfig {

    private Endpoint settlement = new Endpoint("http://localhost:8081", 2000, 10_000);
    private Endpoint messageVault = new Endpoint("http://localhost:8082", 2000, 5000);
    private Endpoint moderation = new Endpoint("http://localhost:8083", 1000, 3000);
    private Endpoint userDirectory = new Endpoint("http://localhost:8084", 1000, 2000);

    @Data
    public static class Endpoint {
        private String baseUrl;
        private int connectTimeoutMs;
        private int readTimeoutMs;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, int connectTimeoutMs, int readTimeoutMs) {
            this.baseUrl = baseUrl;
            this.connectTimeoutMs = connectTimeoutMs;
            this.readTimeoutMs = readTimeoutMs;
        }
    }
}
