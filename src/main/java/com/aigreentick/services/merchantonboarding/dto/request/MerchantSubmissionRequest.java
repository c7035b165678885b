package com.aigreentick.services.merchantonboarding.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.Map;

/**
 * Merchant profile submission. May be sent repeatedly while the merchant fills in the
 * onboarding form; each submission is deep-merged into what is already stored.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Merchant profile submission, deep-merged into the stored profile")
public class MerchantSubmissionRequest {

    @Schema(description = "Platform profile: legalEntity, store (object or array), etc.")
    private Map<String, Object> merchantData;

    @Schema(description = "Practice-management data captured alongside the profile")
    private Map<String, Object> pmbData;

    @NotBlank(message = "User email is required")
    @Email(message = "User email must be a valid address")
    @Schema(description = "Email of the user submitting the profile", example = "owner@clinic.example")
    private String userEmail;

    @JsonProperty("agreementTimeStamp")
    @Schema(description = "When the user accepted the platform agreement", example = "2024-05-01T10:15:30Z")
    private String agreementTimestamp;

    @JsonProperty("businessAssociateAgreementTimeStamp")
    @Schema(description = "When the user accepted the business associate agreement",
            example = "2024-05-01T10:16:02Z")
    private String businessAssociateAgreementTimestamp;

    public boolean carriesProfileData() {
        return merchantData != null || pmbData != null;
    }
}
