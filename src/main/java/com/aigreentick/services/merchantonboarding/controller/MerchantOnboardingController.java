package com.aigreentick.services.merchantonboarding.controller;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.dto.request.MerchantSubmissionRequest;
import com.aigreentick.services.merchantonboarding.dto.response.ApiResponse;
import com.aigreentick.services.merchantonboarding.dto.response.MerchantSubmissionResponse;
import com.aigreentick.services.merchantonboarding.dto.response.OnboardingLinkResponse;
import com.aigreentick.services.merchantonboarding.service.MerchantSubmissionService;
import com.aigreentick.services.merchantonboarding.service.OnboardingOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Merchant-facing onboarding endpoints.
 *
 *   PUT  /merchants/{merchantId}/submission       store or merge the onboarding profile
 *   GET  /merchants/{merchantId}/submission       read it back (never includes the tax identifier)
 *   POST /merchants/{merchantId}/onboarding-link  run the platform saga, return a hosted link
 */
@RestController
@RequestMapping(OnboardingConstants.API_V1 + "/merchants/{merchantId}")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Merchant Onboarding", description = "Profile submission and hosted onboarding links")
public class MerchantOnboardingController {

    private final MerchantSubmissionService submissionService;
    private final OnboardingOrchestrator orchestrator;

    @PutMapping("/submission")
    @Operation(summary = "Submit onboarding data",
            description = "Creates the onboarding record or deep-merges into it. " +
                    "Ignored once an onboarding link has been generated.")
    public ResponseEntity<ApiResponse<Void>> submit(
            @Parameter(description = "Merchant identifier") @PathVariable String merchantId,
            @Valid @RequestBody MerchantSubmissionRequest request
    ) {
        log.info("PUT /merchants/{}/submission", merchantId);
        String message = submissionService.submit(merchantId, request);
        return ResponseEntity.ok(ApiResponse.success(message));
    }

    @GetMapping("/submission")
    @Operation(summary = "Get onboarding data")
    public ResponseEntity<ApiResponse<MerchantSubmissionResponse>> getSubmission(
            @Parameter(description = "Merchant identifier") @PathVariable String merchantId
    ) {
        log.debug("GET /merchants/{}/submission", merchantId);
        MerchantSubmissionResponse response = submissionService.getSubmission(merchantId);
        return ResponseEntity.ok(ApiResponse.success(response, "Onboarding data fetched successfully"));
    }

    @PostMapping("/onboarding-link")
    @Operation(summary = "Generate hosted onboarding link",
            description = "Creates any missing platform entities (legal entity, account holder, business line, " +
                    "split configuration, balance account, store, payment methods) and returns a hosted " +
                    "onboarding link. Safe to call again after a failure.")
    public ResponseEntity<ApiResponse<OnboardingLinkResponse>> generateOnboardingLink(
            @Parameter(description = "Merchant identifier") @PathVariable String merchantId
    ) {
        log.info("POST /merchants/{}/onboarding-link", merchantId);
        OnboardingLinkResponse response = orchestrator.generateOnboardingLink(merchantId);
        return ResponseEntity.ok(ApiResponse.success(response, OnboardingConstants.SUCCESS_LINK_GENERATED));
    }
}
