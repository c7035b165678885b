package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.NotificationCategory;
import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.dto.response.WebhookAcceptedResponse;
import com.aigreentick.services.merchantonboarding.dto.webhook.NormalizedBatch;
import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;
import com.aigreentick.services.merchantonboarding.event.EventBus;
import com.aigreentick.services.merchantonboarding.event.PlatformWebhookEvent;
import com.aigreentick.services.merchantonboarding.exception.WebhookAuthenticationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entry gate for platform notifications.
 *
 * Flow:
 *   1. Normalize the body into notifications (400 on malformed or empty input)
 *   2. Check required fields and HMAC signatures for every item
 *   3. Any failure rejects the whole batch (401): nothing stored, nothing published
 *   4. Store the raw body (500 on failure, nothing published)
 *   5. Skip items already processed
 *   6. Classify and publish the rest; a failed publish is logged, its dedup claim released,
 *      and the batch still succeeds
 *
 * Not @Transactional: the blob write and each dedup claim commit on their own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestionService {

    private final WebhookPayloadNormalizer normalizer;
    private final HmacSignatureValidator signatureValidator;
    private final BlobStore blobStore;
    private final WebhookDeduplicator deduplicator;
    private final EventBus eventBus;

    public WebhookAcceptedResponse ingest(String rawBody) {
        NormalizedBatch batch = normalizer.normalize(rawBody);

        List<String> errors = new ArrayList<>(batch.errors());
        errors.addAll(signatureValidator.validate(batch.notifications()));
        if (!errors.isEmpty()) {
            log.warn("Webhook batch rejected: shape={}, received={}, errors={}",
                    batch.shape(), batch.received(), errors);
            throw new WebhookAuthenticationException(errors);
        }

        String webhookId = UUID.randomUUID().toString();
        String blobKey = blobKey(webhookId, LocalDate.now(ZoneOffset.UTC));
        blobStore.put(blobKey, MediaType.APPLICATION_JSON_VALUE, rawBody);

        int published = 0;
        int duplicates = 0;
        for (WebhookNotification notification : batch.notifications()) {
            if (!deduplicator.claim(notification, webhookId)) {
                duplicates++;
                continue;
            }
            NotificationCategory category = notification.category();
            log.info("Webhook notification accepted: webhookId={}, eventCode={}, pspReference={}, category={}",
                    webhookId, notification.eventCode(), notification.pspReference(), category.getValue());
            try {
                eventBus.publish(new PlatformWebhookEvent(webhookId, blobKey, category, notification));
                published++;
            } catch (RuntimeException e) {
                log.error("Failed to publish notification {} ({}) from webhook {}: {}",
                        notification.pspReference(), notification.eventCode(), webhookId, e.getMessage(), e);
                releaseClaim(notification);
            }
        }

        log.info("Webhook {} processed: received={}, published={}, duplicates={}",
                webhookId, batch.received(), published, duplicates);

        return WebhookAcceptedResponse.builder()
                .webhookId(webhookId)
                .received(batch.received())
                .published(published)
                .duplicates(duplicates)
                .build();
    }

    private void releaseClaim(WebhookNotification notification) {
        try {
            deduplicator.release(notification);
        } catch (RuntimeException e) {
            log.error("Failed to release dedup claim for {}; redelivery will be skipped: {}",
                    notification.dedupKey(), e.getMessage(), e);
        }
    }

    static String blobKey(String webhookId, LocalDate date) {
        return String.format("%s/%04d/%02d/%s.json",
                OnboardingConstants.WEBHOOK_BLOB_PREFIX, date.getYear(), date.getMonthValue(), webhookId);
    }
}
