package com.aigreentick.services.merchantonboarding.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * {@link EventBus} on the application context. Listeners run synchronously on the
 * publishing thread; an exception from a listener reaches the publisher.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus implements EventBus {

    private final ApplicationEventPublisher publisher;

    @Override
    public void publish(PlatformWebhookEvent event) {
        log.debug("Publishing {} event: code={}, webhookId={}",
                event.category().getValue(), event.eventCode(), event.webhookId());
        publisher.publishEvent(event);
    }
}
