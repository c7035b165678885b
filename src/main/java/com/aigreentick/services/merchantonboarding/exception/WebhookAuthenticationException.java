package com.aigreentick.services.merchantonboarding.exception;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when one or more items of a webhook batch fail signature or required-field checks.
 * The whole batch is rejected; {@link #getErrors()} lists one message per failing item.
 */
@Getter
public class WebhookAuthenticationException extends MerchantOnboardingException {

    private final List<String> errors;

    public WebhookAuthenticationException(List<String> errors) {
        super(OnboardingConstants.ERROR_WEBHOOK_VALIDATION_FAILED, "WEBHOOK_AUTHENTICATION_FAILED");
        this.errors = List.copyOf(errors);
    }
}
