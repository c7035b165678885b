package com.aigreentick.services.merchantonboarding.exception;

import lombok.Getter;

/**
 * Thrown when the stored merchant profile lacks data the onboarding saga requires.
 * The message names the missing field so the caller can correct the submission.
 */
@Getter
public class OnboardingValidationException extends MerchantOnboardingException {

    private final String field;

    public OnboardingValidationException(String message, String field) {
        super(message, "VALIDATION_ERROR");
        this.field = field;
    }

    public static OnboardingValidationException missingField(String field) {
        return new OnboardingValidationException(
                "Validation failed: Missing required field '" + field + "' in merchantData", field);
    }

    public static OnboardingValidationException missingStoreField(String field, int index) {
        String path = "store[" + index + "]." + field;
        return new OnboardingValidationException(
                "Validation failed: Missing required field '" + field + "' in merchantData.store[" + index + "]",
                path);
    }

    public static OnboardingValidationException emptyStores() {
        return new OnboardingValidationException(
                "Validation failed: 'store' must contain at least one store in merchantData", "store");
    }
}
