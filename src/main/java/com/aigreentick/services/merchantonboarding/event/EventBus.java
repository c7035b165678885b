package com.aigreentick.services.merchantonboarding.event;

/**
 * Fan-out of accepted webhook notifications to their consumers.
 */
public interface EventBus {

    void publish(PlatformWebhookEvent event);
}
