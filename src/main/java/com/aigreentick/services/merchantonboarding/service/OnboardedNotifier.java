package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.entity.MerchantOnboardingRecord;
import com.aigreentick.services.merchantonboarding.event.MerchantStatusChangedEvent;
import com.aigreentick.services.merchantonboarding.event.OnboardedNotificationPublisher;
import com.aigreentick.services.merchantonboarding.event.OrganizationOnboardedNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.LocalDateTime;

/**
 * Emits the organization-onboarded notification once the ONBOARDED transition has committed.
 * A failure here is logged; the transition itself stands.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OnboardedNotifier {

    static final String SOURCE = "merchant-onboarding-service";

    private final MerchantRecordStore recordStore;
    private final OnboardedNotificationPublisher publisher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onStatusChanged(MerchantStatusChangedEvent event) {
        if (!event.isOnboardedTransition()) {
            return;
        }
        try {
            MerchantOnboardingRecord record = recordStore.getOrThrow(event.merchantId());
            publisher.publish(toNotification(record));
            log.info("Onboarded notification published for merchant {}", event.merchantId());
        } catch (Exception e) {
            log.warn("Failed to publish onboarded notification for merchant {}: {}",
                    event.merchantId(), e.getMessage(), e);
        }
    }

    static OrganizationOnboardedNotification toNotification(MerchantOnboardingRecord record) {
        MerchantProfile profile = MerchantProfile.of(record.getMerchantData());
        return OrganizationOnboardedNotification.builder()
                .merchantId(record.getMerchantId())
                .status(record.getStatus().name())
                .eventType(OnboardingConstants.EVENT_TYPE_ORGANIZATION_ONBOARDED)
                .userEmail(record.getUserEmail())
                .legalEntity(profile.legalEntity())
                .stores(profile.stores())
                .submissionCount(record.getSubmissionCount())
                .agreementTimestamp(record.getAgreementTimestamp())
                .onboardedAt(record.getOnboardedAt() != null ? record.getOnboardedAt() : LocalDateTime.now())
                .timestamp(LocalDateTime.now())
                .source(SOURCE)
                .build();
    }
}
