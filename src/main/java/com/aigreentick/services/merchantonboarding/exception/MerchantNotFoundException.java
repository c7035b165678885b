package com.aigreentick.services.merchantonboarding.exception;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;

/**
 * Thrown when no onboarding record exists for a merchant
 */
public class MerchantNotFoundException extends MerchantOnboardingException {

    public MerchantNotFoundException(String message) {
        super(message, "MERCHANT_NOT_FOUND");
    }

    public static MerchantNotFoundException withMerchantId(String merchantId) {
        return new MerchantNotFoundException(OnboardingConstants.ERROR_MERCHANT_NOT_FOUND + ": " + merchantId);
    }
}
