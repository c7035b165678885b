package com.aigreentick.services.merchantonboarding.dto.webhook;

import java.util.List;

/**
 * Result of normalizing one webhook body.
 *
 * @param received       number of items in the batch, valid or not
 * @param notifications  items that carried an identifier
 * @param errors         one message per item that did not
 */
public record NormalizedBatch(
        String shape,
        int received,
        List<WebhookNotification> notifications,
        List<String> errors
) {

    public NormalizedBatch {
        notifications = List.copyOf(notifications);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
