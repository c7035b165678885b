package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.NotificationCategory;
import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;
import com.aigreentick.services.merchantonboarding.entity.PlatformEventRecord;
import com.aigreentick.services.merchantonboarding.event.PlatformWebhookEvent;
import com.aigreentick.services.merchantonboarding.repository.PlatformEventRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

/**
 * Records standard, kyc and transfer notifications in the platform_events ledger.
 * One row per pspReference; redeliveries are dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationLedgerService {

    static final String PENDING = "pending";
    static final String COMPLETED = "completed";
    static final String FAILED = "failed";
    static final String CANCELLED = "cancelled";

    private static final Set<String> ACCOUNT_HOLDER_FAILED_CODES = Set.of(
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_PASSED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_DENIED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_EXPIRED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_REVOKED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_TERMINATED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_WITHDRAWN"
    );

    private static final Set<String> ACCOUNT_HOLDER_COMPLETED_CODES = Set.of(
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_VERIFIED"
    );

    private static final Map<String, String> TRANSFER_STATUSES = Map.ofEntries(
            Map.entry("TRANSFER_FUNDS", PENDING),
            Map.entry("TRANSFER_FUNDS_FAILED", FAILED),
            Map.entry("TRANSFER_FUNDS_COMPLETED", COMPLETED),
            Map.entry("TRANSFER_FUNDS_DECLINED", FAILED),
            Map.entry("TRANSFER_FUNDS_EXPIRED", FAILED),
            Map.entry("TRANSFER_FUNDS_CANCELLED", CANCELLED),
            Map.entry("TRANSFER_FUNDS_SUSPENDED", PENDING),
            Map.entry("TRANSFER_FUNDS_TERMINATED", FAILED),
            Map.entry("TRANSFER_FUNDS_TRANSFERRED", COMPLETED),
            Map.entry("TRANSFER_FUNDS_UPDATED", PENDING),
            Map.entry("TRANSFER_FUNDS_VALIDATED", PENDING),
            Map.entry("TRANSFER_FUNDS_VERIFIED", COMPLETED),
            Map.entry("TRANSFER_FUNDS_WITHDRAWN", COMPLETED)
    );

    private static final Set<NotificationCategory> RECORDED_CATEGORIES = Set.of(
            NotificationCategory.STANDARD, NotificationCategory.KYC, NotificationCategory.TRANSFER);

    private final PlatformEventRecordRepository repository;

    @EventListener
    public void onPlatformEvent(PlatformWebhookEvent event) {
        if (!RECORDED_CATEGORIES.contains(event.category())) {
            return;
        }
        WebhookNotification notification = event.notification();
        if (repository.existsByPspReference(notification.pspReference())) {
            log.info("Ledger already holds {}, skipping {}", notification.pspReference(), notification.eventCode());
            return;
        }

        PlatformEventRecord entry = PlatformEventRecord.builder()
                .eventId(event.webhookId())
                .eventCode(notification.eventCode())
                .category(event.category().getValue())
                .entityType(event.category().getValue())
                .entityId(entityId(notification))
                .blobKey(event.blobKey())
                .pspReference(notification.pspReference())
                .merchantAccountCode(notification.merchantAccountCode())
                .merchantReference(notification.merchantReference())
                .success(Boolean.valueOf(notification.success()))
                .reason(notification.reason())
                .status(status(event.category(), notification))
                .build();

        try {
            repository.saveAndFlush(entry);
            log.info("Ledger entry recorded: category={}, pspReference={}, eventCode={}, status={}",
                    entry.getCategory(), entry.getPspReference(), entry.getEventCode(), entry.getStatus());
        } catch (DataIntegrityViolationException e) {
            log.info("Ledger entry for {} / {} written concurrently, skipping",
                    notification.pspReference(), notification.eventCode());
        }
    }

    private static String entityId(WebhookNotification notification) {
        String reference = notification.merchantReference();
        return reference != null && !"unknown".equals(reference) ? reference : notification.pspReference();
    }

    /**
     * Ledger status: kyc and transfer statuses carry their category as prefix
     * (kyc_pending, transfer_failed, ...). An unsuccessful notification is always failed.
     */
    static String status(NotificationCategory category, WebhookNotification notification) {
        String prefix = switch (category) {
            case KYC -> "kyc_";
            case TRANSFER -> "transfer_";
            default -> "";
        };
        return prefix + baseStatus(category, notification);
    }

    private static String baseStatus(NotificationCategory category, WebhookNotification notification) {
        if ("false".equals(notification.success())) {
            return FAILED;
        }
        String eventCode = notification.eventCode();
        if (category == NotificationCategory.TRANSFER) {
            String transferStatus = notification.item() != null
                    ? notification.item().path("data").path("balancePlatform").path("transfer").path("status").asText("")
                    : "";
            switch (transferStatus.toLowerCase()) {
                case "completed", "transferred":
                    return COMPLETED;
                case "failed", "declined", "terminated":
                    return FAILED;
                case "cancelled":
                    return CANCELLED;
                default:
                    return TRANSFER_STATUSES.getOrDefault(eventCode, PENDING);
            }
        }
        if (ACCOUNT_HOLDER_FAILED_CODES.contains(eventCode)) {
            return FAILED;
        }
        if (ACCOUNT_HOLDER_COMPLETED_CODES.contains(eventCode)) {
            return COMPLETED;
        }
        return PENDING;
    }
}
