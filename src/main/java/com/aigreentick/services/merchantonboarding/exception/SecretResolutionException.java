package com.aigreentick.services.merchantonboarding.exception;

/**
 * Thrown when a named secret cannot be resolved. Fatal to the calling handler.
 */
public class SecretResolutionException extends MerchantOnboardingException {

    public SecretResolutionException(String message) {
        super(message, "SECRET_RESOLUTION_FAILED");
    }

    public static SecretResolutionException missing(String name) {
        return new SecretResolutionException("Secret not configured: " + name);
    }
}
