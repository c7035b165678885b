package com.aigreentick.services.merchantonboarding.exception;

/**
 * Thrown for requests that cannot be parsed or interpreted
 */
public class InvalidRequestException extends MerchantOnboardingException {

    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    public static InvalidRequestException missingBody() {
        return new InvalidRequestException("Missing request body");
    }

    public static InvalidRequestException malformedJson() {
        return new InvalidRequestException("Request body is not valid JSON");
    }

    public static InvalidRequestException invalidWebhookPayload() {
        return new InvalidRequestException("Invalid webhook payload structure");
    }

    public static InvalidRequestException noNotificationItems() {
        return new InvalidRequestException("No valid notification items found in payload");
    }
}
