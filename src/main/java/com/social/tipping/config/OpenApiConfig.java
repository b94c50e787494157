package com.social.tipping.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tipPipelineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tip Pipeline API")
                        .version("1.0.0")
                        .description(
                                "Submission and processing of token tips between users.\n\n" +
                                "**Submission:**\n" +
                                "1. Receive a tip via `POST /api/v1/tips`\n" +
                                "2. Check sliding-window rate limits (user, IP, wallet, large amounts)\n" +
                                "3. Run abuse checks concurrently; a rejection returns **422**, a flag queues the tip for review\n" +
                                "4. Moderate and seal the optional message\n" +
                                "5. Enqueue a deduplicated processing job\n\n" +
                                "**Processing:** a bounded worker pool settles each tip, updates the leaderboards and " +
                                "fires enrichments (ledger, achievements, notifications). Transient failures are retried " +
                                "with exponential backoff, exhausted or permanent ones go to the dead-letter list.\n\n" +
                                "**Leaderboards:** `GET /api/v1/leaderboard/{all|weekly}?category=senders|recipients`")
                        .contact(new Contact().name("Tipping Team")));
    }
}
