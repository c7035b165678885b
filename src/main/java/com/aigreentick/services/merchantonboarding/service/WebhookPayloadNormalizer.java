package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.dto.webhook.InboundWebhookPayload;
import com.aigreentick.services.merchantonboarding.dto.webhook.NormalizedBatch;
import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;
import com.aigreentick.services.merchantonboarding.exception.InvalidRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw webhook body into {@link WebhookNotification}s.
 *
 * Field fallbacks:
 *   eventCode           ← eventCode | type | "unknown"
 *   pspReference        ← pspReference | data.id | id
 *   merchantAccountCode ← merchantAccountCode | data.balancePlatform | "unknown"
 *   merchantReference   ← merchantReference | data.accountHolder.id | "unknown"
 *   success             ← success | "true"
 *   eventDate           ← eventDate | timestamp
 *   accountHolderId     ← accountHolderId | data.accountHolder.id
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookPayloadNormalizer {

    private static final String UNKNOWN = "unknown";

    private final ObjectMapper objectMapper;

    public NormalizedBatch normalize(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw InvalidRequestException.missingBody();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            log.warn("Webhook body is not valid JSON: {}", e.getOriginalMessage());
            throw InvalidRequestException.malformedJson();
        }

        InboundWebhookPayload payload = InboundWebhookPayload.from(root);
        List<JsonNode> elements = payload.elements();
        if (elements.isEmpty()) {
            throw InvalidRequestException.noNotificationItems();
        }

        List<WebhookNotification> notifications = new ArrayList<>(elements.size());
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < elements.size(); i++) {
            int position = i + 1;
            JsonNode item = InboundWebhookPayload.unwrapItem(elements.get(i));

            String nativePsp = text(item, "pspReference");
            String pspReference = firstPresent(nativePsp, text(item.path("data"), "id"), text(item, "id"));
            if (pspReference == null) {
                errors.add("Notification item " + position + " missing required fields");
                continue;
            }
            notifications.add(toNotification(position, item, pspReference, nativePsp != null));
        }

        log.debug("Webhook normalized: shape={}, received={}, valid={}, errors={}",
                payload.shape(), elements.size(), notifications.size(), errors.size());
        return new NormalizedBatch(payload.shape(), elements.size(), notifications, errors);
    }

    private WebhookNotification toNotification(int position, JsonNode item, String pspReference, boolean nativePsp) {
        JsonNode data = item.path("data");
        String holderId = text(data.path("accountHolder"), "id");
        String type = text(item, "type");

        return new WebhookNotification(
                position,
                firstPresent(text(item, "eventCode"), type, UNKNOWN),
                pspReference,
                nativePsp,
                firstPresent(text(item, "merchantAccountCode"), text(data, "balancePlatform"), UNKNOWN),
                firstPresent(text(item, "merchantReference"), holderId, UNKNOWN),
                text(item.path("amount"), "value"),
                text(item.path("amount"), "currency"),
                firstPresent(text(item, "success"), "true"),
                text(item, "reason"),
                firstPresent(text(item, "eventDate"), text(item, "timestamp")),
                text(item.path("additionalData"), "hmacSignature"),
                firstPresent(text(item, "accountHolderId"), holderId),
                isBalancePlatformType(type) || isBalancePlatformType(text(data, "type")),
                item
        );
    }

    private static boolean isBalancePlatformType(String type) {
        return type != null && type.startsWith(OnboardingConstants.BALANCE_PLATFORM_EVENT_PREFIX);
    }

    /**
     * Scalar field as text; null when absent, null, empty, or not a scalar.
     */
    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
