package com.aigreentick.services.merchantonboarding.constants;

import java.util.Set;

/**
 * Routing category of an inbound platform notification.
 * Every event code maps to exactly one category; unknown codes are STANDARD.
 */
public enum NotificationCategory {
    STANDARD("standard"),
    KYC("kyc"),
    TRANSFER("transfer"),
    BALANCE_PLATFORM("balancePlatform");

    private static final Set<String> KYC_EVENT_CODES = Set.of(
            "ACCOUNT_HOLDER_STATUS_CHANGE",
            "ACCOUNT_HOLDER_VERIFICATION",
            "ACCOUNT_HOLDER_UPCOMING_DEADLINE",
            "ACCOUNT_HOLDER_PAYOUT_METHOD_ADDED",
            "ACCOUNT_HOLDER_PAYOUT_METHOD_REMOVED",
            "ACCOUNT_HOLDER_PAYOUT_METHOD_REQUIRED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_REMINDER",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_PASSED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENDED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_REQUESTED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_DENIED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_APPROVED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_CANCELLED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_EXPIRED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_REVOKED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_SUSPENDED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_TERMINATED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_TRANSFERRED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_UPDATED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_VALIDATED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_VERIFIED",
            "ACCOUNT_HOLDER_VERIFICATION_DEADLINE_EXTENSION_WITHDRAWN"
    );

    private static final Set<String> TRANSFER_EVENT_CODES = Set.of(
            "TRANSFER_FUNDS",
            "TRANSFER_FUNDS_FAILED",
            "TRANSFER_FUNDS_COMPLETED",
            "TRANSFER_FUNDS_DECLINED",
            "TRANSFER_FUNDS_EXPIRED",
            "TRANSFER_FUNDS_CANCELLED",
            "TRANSFER_FUNDS_SUSPENDED",
            "TRANSFER_FUNDS_TERMINATED",
            "TRANSFER_FUNDS_TRANSFERRED",
            "TRANSFER_FUNDS_UPDATED",
            "TRANSFER_FUNDS_VALIDATED",
            "TRANSFER_FUNDS_VERIFIED",
            "TRANSFER_FUNDS_WITHDRAWN"
    );

    private static final Set<String> BALANCE_PLATFORM_EVENT_CODES = Set.of(
            "balancePlatform.accountHolder.updated",
            "balancePlatform.accountHolder.created",
            "balancePlatform.accountHolder.verification",
            "balancePlatform.account.updated",
            "balancePlatform.account.created",
            "balancePlatform.legalEntity.updated",
            "balancePlatform.legalEntity.created",
            "balancePlatform.transfer.updated",
            "balancePlatform.transfer.created",
            "balancePlatform.transfer.failed",
            "balancePlatform.transfer.completed"
    );

    private final String value;

    NotificationCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static NotificationCategory classify(String eventCode) {
        if (eventCode == null) return STANDARD;
        if (KYC_EVENT_CODES.contains(eventCode)) return KYC;
        if (TRANSFER_EVENT_CODES.contains(eventCode)) return TRANSFER;
        if (BALANCE_PLATFORM_EVENT_CODES.contains(eventCode)) return BALANCE_PLATFORM;
        return STANDARD;
    }
}
