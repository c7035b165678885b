package com.aigreentick.services.merchantonboarding.event;

/**
 * Delivers {@link OrganizationOnboardedNotification}s to downstream systems.
 */
public interface OnboardedNotificationPublisher {

    void publish(OrganizationOnboardedNotification notification);
}
