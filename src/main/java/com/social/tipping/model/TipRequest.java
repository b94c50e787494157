package com.social.tipping.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A tip as submitted by a client")
public class TipRequest {

    @NotBlank
    @Size(max = 64)
    @Schema(description = "Sending user", example = "user-123", requiredMode = Schema.RequiredMode.REQUIRED)
    private String senderId;

    @NotBlank
    @Size(max = 64)
    @Schema(description = "Receiving user", example = "user-456", requiredMode = Schema.RequiredMode.REQUIRED)
    private String recipientId;

    @NotBlank
    @Pattern(regexp = "\\d{1,20}", message = "must be a decimal integer in the token's smallest unit")
    @Schema(description = "Amount in the token's smallest unit, as a decimal string",
            example = "1500000", requiredMode = Schema.RequiredMode.REQUIRED)
    private String amountSmallestUnit;

    @Size(max = 1000)
    @Schema(description = "Optional message attached to the tip", example = "Thanks for the great post!")
    private String message;

    @Schema(description = "Client network address; taken from the request when absent", example = "203.0.113.7")
    private String clientIp;
}
