package com.social.tipping.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Content moderation outcome for the tip message")
public class ModerationVerdict {

    @Schema(description = "Whether the message is safe to deliver", example = "true")
    private boolean safe;

    @Schema(description = "What the pipeline does with the message", example = "ALLOW")
    private ModerationAction action;

    @Schema(description = "Categories reported by the moderation service", example = "[\"spam\"]")
    private List<String> categories;

    public static ModerationVerdict skipped() {
        return new ModerationVerdict(true, ModerationAction.ALLOW, List.of());
    }

    public static ModerationVerdict unavailable() {
        return new ModerationVerdict(true, ModerationAction.WARN, List.of("moderation-unavailable"));
    }
}
