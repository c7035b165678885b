package com.aigreentick.services.merchantonboarding.dto.response;

import com.aigreentick.services.merchantonboarding.constants.OnboardingStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.util.Map;

/**
 * Stored profile as returned to the merchant's frontend. Never carries the tax identifier.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Stored merchant onboarding submission")
public class MerchantSubmissionResponse {

    private Map<String, Object> merchantData;

    @Schema(description = "Practice-management data, with 'tin' removed")
    private Map<String, Object> pmbData;

    @Schema(description = "Onboarding status", example = "READY_FOR_PLATFORM")
    private OnboardingStatus status;

    @JsonProperty("agreementTimeStamp")
    private String agreementTimestamp;

    @JsonProperty("businessAssociateAgreementTimeStamp")
    private String businessAssociateAgreementTimestamp;

    @Schema(description = "True once the hosted onboarding link has been issued", example = "false")
    private boolean hasGeneratedLink;
}
