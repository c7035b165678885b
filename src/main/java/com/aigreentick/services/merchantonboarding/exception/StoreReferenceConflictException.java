package com.aigreentick.services.merchantonboarding.exception;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;

/**
 * Thrown when the platform rejects a store because its reference is already taken.
 * Terminal for the given input: resubmitting the same reference fails the same way.
 */
public class StoreReferenceConflictException extends MerchantOnboardingException {

    public StoreReferenceConflictException(String message, Throwable cause) {
        super(message, "STORE_REFERENCE_CONFLICT", cause);
    }

    public static StoreReferenceConflictException of(PlatformApiException cause) {
        return new StoreReferenceConflictException(OnboardingConstants.ERROR_STORE_REFERENCE_EXISTS, cause);
    }
}
