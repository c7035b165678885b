package com.aigreentick.services.merchantonboarding.event;

import com.aigreentick.services.merchantonboarding.constants.OnboardingStatus;

/**
 * Published inside the writing transaction whenever a record's status changes.
 * Listeners that act outward must bind to AFTER_COMMIT.
 */
public record MerchantStatusChangedEvent(
        String merchantId,
        OnboardingStatus previousStatus,
        OnboardingStatus newStatus
) {

    public boolean isOnboardedTransition() {
        return newStatus == OnboardingStatus.ONBOARDED && previousStatus != OnboardingStatus.ONBOARDED;
    }
}
