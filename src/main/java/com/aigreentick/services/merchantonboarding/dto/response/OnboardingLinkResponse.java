package com.aigreentick.services.merchantonboarding.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Hosted onboarding link issued by the payment platform")
public class OnboardingLinkResponse {

    @Schema(description = "One-time hosted onboarding URL", example = "https://balanceplatform.example/onboard/abc123")
    private String url;
}
