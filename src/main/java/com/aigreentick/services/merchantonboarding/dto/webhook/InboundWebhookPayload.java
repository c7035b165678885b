package com.aigreentick.services.merchantonboarding.dto.webhook;

import com.aigreentick.services.merchantonboarding.exception.InvalidRequestException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The shapes a platform webhook body arrives in.
 *
 * Checked in this order, first match wins:
 *   1. { "notificationItems": [ ... ] }
 *   2. { "notifications": [ ... ] }
 *   3. { "items": [ ... ] }
 *   4. [ ... ]
 *   5. { "NotificationRequestItem": { ... } }
 *   6. { "notification": { ... } }
 *   7. { "item": { ... } }
 *   8. any other object, taken as a single notification
 *
 * Each element of a batch may be wrapped once more; see {@link #unwrapItem(JsonNode)}.
 */
public sealed interface InboundWebhookPayload
        permits InboundWebhookPayload.ItemArray,
                InboundWebhookPayload.BareArray,
                InboundWebhookPayload.WrappedItem,
                InboundWebhookPayload.BareItem {

    String NOTIFICATION_ITEMS = "notificationItems";
    String NOTIFICATIONS = "notifications";
    String ITEMS = "items";
    String NOTIFICATION_REQUEST_ITEM = "NotificationRequestItem";
    String NOTIFICATION = "notification";
    String ITEM = "item";

    /** Raw elements of the batch, before per-item unwrapping. */
    List<JsonNode> elements();

    /** Name of the shape, for logging. */
    String shape();

    /** Batch under a named array field. */
    record ItemArray(String field, List<JsonNode> elements) implements InboundWebhookPayload {
        public String shape() {
            return field + "[]";
        }
    }

    /** Top-level JSON array. */
    record BareArray(List<JsonNode> elements) implements InboundWebhookPayload {
        public String shape() {
            return "array";
        }
    }

    /** Single notification under a wrapper field. */
    record WrappedItem(String field, JsonNode item) implements InboundWebhookPayload {
        public List<JsonNode> elements() {
            return List.of(item);
        }

        public String shape() {
            return field;
        }
    }

    /** The body is the notification. */
    record BareItem(JsonNode item) implements InboundWebhookPayload {
        public List<JsonNode> elements() {
            return List.of(item);
        }

        public String shape() {
            return "object";
        }
    }

    static InboundWebhookPayload from(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw InvalidRequestException.missingBody();
        }
        if (root.isArray()) {
            return new BareArray(toList(root));
        }
        if (!root.isObject()) {
            throw InvalidRequestException.invalidWebhookPayload();
        }

        for (String field : List.of(NOTIFICATION_ITEMS, NOTIFICATIONS, ITEMS)) {
            JsonNode candidate = root.get(field);
            if (candidate != null && candidate.isArray()) {
                return new ItemArray(field, toList(candidate));
            }
        }
        for (String field : List.of(NOTIFICATION_REQUEST_ITEM, NOTIFICATION, ITEM)) {
            JsonNode candidate = root.get(field);
            if (isPresent(candidate)) {
                return new WrappedItem(field, candidate);
            }
        }
        return new BareItem(root);
    }

    /**
     * Strips one level of NotificationRequestItem / notification / item wrapping from a batch element.
     */
    static JsonNode unwrapItem(JsonNode element) {
        for (String field : List.of(NOTIFICATION_REQUEST_ITEM, NOTIFICATION, ITEM)) {
            JsonNode inner = element.get(field);
            if (isPresent(inner)) {
                return inner;
            }
        }
        return element;
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !(node.isTextual() && node.asText().isEmpty());
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> elements = new ArrayList<>(array.size());
        array.forEach(elements::add);
        return elements;
    }
}
