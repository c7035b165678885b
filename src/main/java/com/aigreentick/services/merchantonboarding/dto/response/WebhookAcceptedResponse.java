package com.aigreentick.services.merchantonboarding.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

/**
 * Result of ingesting one webhook batch.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Webhook batch ingestion summary")
public class WebhookAcceptedResponse {

    @Schema(description = "Identifier of the stored raw payload", example = "6f1c2f0e-6c1e-4d8f-9b45-3a0c1f2d9e77")
    private String webhookId;

    @Schema(description = "Notification items in the batch", example = "3")
    private int received;

    @Schema(description = "Items published to the event bus", example = "2")
    private int published;

    @Schema(description = "Items skipped as already processed", example = "1")
    private int duplicates;
}
