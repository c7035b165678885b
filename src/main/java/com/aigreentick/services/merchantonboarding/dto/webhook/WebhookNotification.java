package com.aigreentick.services.merchantonboarding.dto.webhook;

import com.aigreentick.services.merchantonboarding.constants.NotificationCategory;
import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One platform notification, normalized from whichever payload shape it arrived in.
 *
 * Classic payment notifications carry a pspReference; balance-platform notifications only
 * carry {@code data.id} or {@code id} and a {@code type}. Both end up here with the same
 * field names. {@link #item()} keeps the unwrapped JSON for signature checks and for
 * consumers that need more than the normalized fields.
 *
 * @param position              1-based position in the batch
 * @param nativePspReference    true when the item carried its own pspReference
 * @param balancePlatform       true for balance-platform events, which are not HMAC-signed
 */
public record WebhookNotification(
        int position,
        String eventCode,
        String pspReference,
        boolean nativePspReference,
        String merchantAccountCode,
        String merchantReference,
        String amountValue,
        String amountCurrency,
        String success,
        String reason,
        String eventDate,
        String hmacSignature,
        String accountHolderId,
        boolean balancePlatform,
        JsonNode item
) {

    public NotificationCategory category() {
        return NotificationCategory.classify(eventCode);
    }

    /**
     * Key under which this notification is recorded as processed.
     * The pspReference alone for classic notifications, so a redelivery under another event code
     * is still a duplicate. id:eventCode:eventDate otherwise (a balance-platform resource id
     * repeats across its updates).
     */
    public String dedupKey() {
        if (nativePspReference) {
            return pspReference;
        }
        return pspReference + ":" + eventCode + ":" + (eventDate != null ? eventDate : "");
    }

    public boolean isAccountHolderEvent() {
        return OnboardingConstants.EVENT_ACCOUNT_HOLDER_UPDATED.equals(eventCode)
                || OnboardingConstants.EVENT_ACCOUNT_HOLDER_CREATED.equals(eventCode);
    }

    /**
     * The account holder snapshot carried by the notification: {@code data.accountHolder},
     * or a top-level {@code accountHolder}. Null when neither is present.
     */
    public JsonNode accountHolder() {
        if (item == null) {
            return null;
        }
        JsonNode nested = item.path("data").path("accountHolder");
        if (nested.isObject()) {
            return nested;
        }
        JsonNode topLevel = item.path("accountHolder");
        return topLevel.isObject() ? topLevel : null;
    }
}
