package com.aigreentick.services.merchantonboarding.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Outward signal that a merchant finished onboarding. Emitted once per merchant.
 * Carries no tax identifier.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrganizationOnboardedNotification {

    private final String merchantId;
    private final String status;
    private final String eventType;
    private final String userEmail;
    private final Map<String, Object> legalEntity;
    private final List<Map<String, Object>> stores;
    private final Integer submissionCount;
    private final String agreementTimestamp;
    private final LocalDateTime onboardedAt;
    private final LocalDateTime timestamp;
    private final String source;
}
