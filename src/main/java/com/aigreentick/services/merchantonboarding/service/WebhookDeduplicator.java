package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;
import com.aigreentick.services.merchantonboarding.entity.ProcessedNotification;
import com.aigreentick.services.merchantonboarding.repository.ProcessedNotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Claims a notification's dedup key in the processed_notifications ledger.
 *
 * The unique constraint on dedup_key decides races: two concurrent deliveries of the same
 * notification both pass the existence check, only one insert succeeds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookDeduplicator {

    private final ProcessedNotificationRepository repository;

    /**
     * @return true if this call claimed the key, false if it was already processed
     */
    public boolean claim(WebhookNotification notification, String webhookId) {
        String key = notification.dedupKey();
        if (repository.existsByDedupKey(key)) {
            log.info("Duplicate notification skipped: key={}", key);
            return false;
        }
        try {
            repository.saveAndFlush(ProcessedNotification.builder()
                    .dedupKey(key)
                    .webhookId(webhookId)
                    .eventCode(notification.eventCode())
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Duplicate notification skipped (concurrent claim): key={}", key);
            return false;
        }
    }

    /**
     * Gives a claimed key back after its notification could not be published,
     * so the platform's redelivery is processed instead of skipped.
     */
    @Transactional
    public void release(WebhookNotification notification) {
        String key = notification.dedupKey();
        int deleted = repository.deleteByDedupKey(key);
        log.info("Released dedup claim: key={}, deleted={}", key, deleted);
    }
}
