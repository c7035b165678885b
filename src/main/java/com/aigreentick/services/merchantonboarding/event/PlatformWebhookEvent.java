package com.aigreentick.services.merchantonboarding.event;

import com.aigreentick.services.merchantonboarding.constants.NotificationCategory;
import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;

/**
 * One accepted, deduplicated platform notification, fanned out to downstream consumers.
 *
 * @param blobKey  where the raw batch body is stored
 */
public record PlatformWebhookEvent(
        String webhookId,
        String blobKey,
        NotificationCategory category,
        WebhookNotification notification
) {

    public String eventCode() {
        return notification.eventCode();
    }
}
