package com.aigreentick.services.merchantonboarding.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

/**
 * Outcome of applying one account-holder event to a merchant record.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Capability verification processing summary")
public class VerificationResult {

    public enum Outcome {
        /** Event type is not handled by this entry point */
        IGNORED,
        /** No merchant record references the account holder */
        NO_MATCHING_MERCHANT,
        /** Precondition for the event type not met */
        SKIPPED,
        /** Record updated (or nothing to change) */
        PROCESSED,
        /** Processing raised an error; reported, not thrown */
        FAILED
    }

    private Outcome outcome;

    private String merchantId;

    private String accountHolderId;

    @Schema(description = "True when all six capability flags are set", example = "true")
    private boolean allVerified;

    @Schema(description = "True when a sweep was created by this event", example = "true")
    private boolean sweepCreated;

    @Schema(description = "True when this event moved the merchant to ONBOARDED", example = "true")
    private boolean onboarded;

    private String message;

    public static VerificationResult of(Outcome outcome, String accountHolderId, String message) {
        return VerificationResult.builder()
                .outcome(outcome)
                .accountHolderId(accountHolderId)
                .message(message)
                .build();
    }
}
