package com.aigreentick.services.merchantonboarding.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes each notification as one JSON line to the {@code onboarding.events} logger,
 * where the log shipper picks it up.
 */
@Component
@RequiredArgsConstructor
@Slf4j(topic = "onboarding.events")
public class LoggingOnboardedNotificationPublisher implements OnboardedNotificationPublisher {

    private final ObjectMapper objectMapper;

    @Override
    public void publish(OrganizationOnboardedNotification notification) {
        try {
            log.info(objectMapper.writeValueAsString(notification));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize onboarded notification for "
                    + notification.getMerchantId(), e);
        }
    }
}
