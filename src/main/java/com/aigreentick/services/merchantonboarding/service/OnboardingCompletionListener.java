package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.dto.response.VerificationResult;
import com.aigreentick.services.merchantonboarding.dto.webhook.AccountHolderSnapshot;
import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;
import com.aigreentick.services.merchantonboarding.event.PlatformWebhookEvent;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Feeds ingested account holder created/updated notifications into the verification
 * state machine (tax-gated variant). Other notifications are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OnboardingCompletionListener {

    private final VerificationStateMachine stateMachine;

    @EventListener
    public void onPlatformEvent(PlatformWebhookEvent event) {
        WebhookNotification notification = event.notification();
        if (!notification.isAccountHolderEvent()) {
            return;
        }

        AccountHolderSnapshot snapshot = snapshotOf(notification);
        if (snapshot.accountHolderId() == null) {
            log.error("Could not extract account holder id from notification {} in webhook {}",
                    notification.pspReference(), event.webhookId());
            return;
        }

        try {
            VerificationResult result = stateMachine.process(
                    VerificationStateMachine.Variant.COMPLETION, notification.eventCode(), snapshot);
            log.info("Completion processing for account holder {}: outcome={}, onboarded={}",
                    snapshot.accountHolderId(), result.getOutcome(), result.isOnboarded());
        } catch (RuntimeException e) {
            log.error("Completion processing failed for account holder {}: {}",
                    snapshot.accountHolderId(), e.getMessage(), e);
        }
    }

    static AccountHolderSnapshot snapshotOf(WebhookNotification notification) {
        JsonNode accountHolder = notification.accountHolder();
        if (accountHolder != null) {
            AccountHolderSnapshot snapshot = AccountHolderSnapshot.from(accountHolder);
            if (snapshot.accountHolderId() != null) {
                return snapshot;
            }
        }
        return AccountHolderSnapshot.idOnly(notification.accountHolderId());
    }
}
