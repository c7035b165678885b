package com.aigreentick.services.merchantonboarding.constants;

/**
 * Discrete steps in the onboarding saga.
 * Order matters: each step depends on the identifier produced by an earlier one.
 * A step is skipped when its identifier is already recorded in the creation progress.
 */
public enum OnboardingStep {
    LEGAL_ENTITY("Failed to create Legal Entity on the payment platform."),
    SOLE_PROPRIETORSHIP("Failed to create or map sole proprietorship entity."),
    ACCOUNT_HOLDER("Failed to create account holder."),
    BUSINESS_LINE("Failed to create business line."),
    SPLIT_CONFIGURATION("Failed to create split configuration."),
    BALANCE_ACCOUNT("Failed to create balance account."),
    STORE("Failed to create store on the payment platform."),
    VISA_PAYMENT_METHOD("Failed to create Visa payment method."),
    MASTERCARD_PAYMENT_METHOD("Failed to create Mastercard payment method."),
    ONBOARDING_LINK("Failed to create onboarding link.");

    private final String failureMessage;

    OnboardingStep(String failureMessage) {
        this.failureMessage = failureMessage;
    }

    /** Caller-facing message used when this step's platform call fails. */
    public String getFailureMessage() {
        return failureMessage;
    }
}
