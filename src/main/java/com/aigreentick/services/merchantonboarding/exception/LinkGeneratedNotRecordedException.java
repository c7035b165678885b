package com.aigreentick.services.merchantonboarding.exception;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;

/**
 * Thrown when the hosted onboarding link was produced but the confirming write failed.
 * The link may already be in the merchant's hands, so this needs operator attention
 * rather than an automated retry.
 */
public class LinkGeneratedNotRecordedException extends MerchantOnboardingException {

    public LinkGeneratedNotRecordedException(String message, Throwable cause) {
        super(message, "LINK_GENERATED_NOT_RECORDED", cause);
    }

    public static LinkGeneratedNotRecordedException progressNotSaved(Throwable cause) {
        return new LinkGeneratedNotRecordedException(OnboardingConstants.ERROR_LINK_SAVE_FAILED, cause);
    }

    public static LinkGeneratedNotRecordedException flagNotSaved(Throwable cause) {
        return new LinkGeneratedNotRecordedException(OnboardingConstants.ERROR_LINK_STATUS_FAILED, cause);
    }
}
