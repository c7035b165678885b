package com.aigreentick.services.merchantonboarding.controller;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.dto.response.ApiResponse;
import com.aigreentick.services.merchantonboarding.dto.response.VerificationResult;
import com.aigreentick.services.merchantonboarding.dto.response.WebhookAcceptedResponse;
import com.aigreentick.services.merchantonboarding.service.VerificationStateMachine;
import com.aigreentick.services.merchantonboarding.service.WebhookIngestionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Payment platform webhook endpoints.
 *
 *   POST /webhooks/platform        signed notification batches → 202, 401 if any item fails checks
 *   POST /webhooks/account-holder  account holder updates → always 200 with a processing summary
 *
 * Bodies are read as String: the platform body is stored verbatim, and a malformed
 * account holder body must still be acknowledged.
 */
@RestController
@RequestMapping(OnboardingConstants.API_V1 + "/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "Payment platform notification endpoints")
public class WebhookController {

    private final WebhookIngestionService ingestionService;
    private final VerificationStateMachine stateMachine;
    private final ObjectMapper objectMapper;

    @PostMapping(value = "/platform", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Receive platform notifications",
            description = "Validates every item (HMAC for classic notifications), stores the raw body, " +
                    "then publishes each new notification. The whole batch is rejected if any item fails.")
    public ResponseEntity<ApiResponse<WebhookAcceptedResponse>> receivePlatformWebhook(
            @RequestBody(required = false) String rawBody
    ) {
        log.debug("Platform webhook received");
        WebhookAcceptedResponse response = ingestionService.ingest(rawBody);
        return ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(response, OnboardingConstants.SUCCESS_WEBHOOK_ACCEPTED));
    }

    @PostMapping("/account-holder")
    @Operation(summary = "Receive account holder updates",
            description = "Applies capability verification updates. Always acknowledges with 200.")
    public ResponseEntity<ApiResponse<VerificationResult>> receiveAccountHolderWebhook(
            @RequestBody(required = false) String rawBody
    ) {
        VerificationResult result;
        try {
            JsonNode body = objectMapper.readTree(rawBody == null || rawBody.isBlank() ? "{}" : rawBody);
            result = stateMachine.applyWebhook(body);
        } catch (JsonProcessingException e) {
            log.error("Account holder webhook body is not valid JSON: {}", e.getOriginalMessage());
            result = VerificationResult.of(VerificationResult.Outcome.FAILED, null,
                    "Webhook received but error occurred during processing: invalid JSON");
        }
        return ResponseEntity.ok(ApiResponse.success(result, result.getMessage()));
    }
}
