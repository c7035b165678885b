package com.aigreentick.services.merchantonboarding.constants;

/**
 * Lifecycle of a merchant onboarding record.
 * Forward only: a record never moves to an earlier status.
 */
public enum OnboardingStatus {
    SUBMITTED,
    READY_FOR_PLATFORM,
    ONBOARDED;

    public boolean isTerminal() {
        return this == ONBOARDED;
    }

    /**
     * Returns whichever of this and {@code target} is further along.
     * Used wherever a status is derived from data, so a re-derivation can never regress it.
     */
    public OnboardingStatus advanceTo(OnboardingStatus target) {
        return target.ordinal() > this.ordinal() ? target : this;
    }
}
