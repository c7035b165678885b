package com.aigreentick.services.merchantonboarding.exception;

import lombok.Getter;

/**
 * Base exception for all merchant onboarding service exceptions
 */
@Getter
public class MerchantOnboardingException extends RuntimeException {

    private final String errorCode;

    public MerchantOnboardingException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public MerchantOnboardingException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
