package com.social.tipping.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a single abuse check")
public class AbuseCheckResult {

    @Schema(description = "Check that produced this result", example = "VELOCITY")
    private AbuseCheckType checkType;

    @Schema(description = "Whether the check lets the tip through", example = "false")
    private boolean allowed;

    @Schema(description = "Human-readable explanation when rejected or flagged",
            example = "Too many tips in a short period. Please wait 42 seconds.")
    private String reason;

    @Schema(description = "Severity of the finding", example = "HIGH")
    private Severity severity;

    @Schema(description = "Allowed but should be looked at by an operator", example = "false")
    private boolean flaggedForReview;

    @Schema(description = "Check-specific values behind the decision")
    private Map<String, Object> metadata;

    public static AbuseCheckResult pass(AbuseCheckType type) {
        return AbuseCheckResult.builder()
                .checkType(type)
                .allowed(true)
                .severity(Severity.LOW)
                .build();
    }

    public static AbuseCheckResult reject(AbuseCheckType type, Severity severity, String reason,
                                          Map<String, Object> metadata) {
        return AbuseCheckResult.builder()
                .checkType(type)
                .allowed(false)
                .severity(severity)
                .reason(reason)
                .metadata(metadata)
                .build();
    }

    public static AbuseCheckResult flag(AbuseCheckType type, Severity severity, String reason,
                                        Map<String, Object> metadata) {
        return AbuseCheckResult.builder()
                .checkType(type)
                .allowed(true)
                .flaggedForReview(true)
                .severity(severity)
                .reason(reason)
                .metadata(metadata)
                .build();
    }
}
