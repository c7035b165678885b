package com.aigreentick.services.merchantonboarding.service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Deep merge for profile documents.
 *
 * Rules:
 *   - nested objects merge recursively
 *   - scalars and arrays in the incoming document overwrite
 *   - {@code legalEntity} is replaced wholesale when its {@code type} changes,
 *     so fields of the old entity type never leak into the new one
 *
 * Inputs are never mutated; the result is a fresh map.
 */
public final class ProfileMerger {

    private static final String LEGAL_ENTITY = "legalEntity";

    private ProfileMerger() {
    }

    public static Map<String, Object> deepMerge(Map<String, Object> existing, Map<String, Object> incoming) {
        Map<String, Object> output = new LinkedHashMap<>();
        if (existing != null) {
            output.putAll(existing);
        }
        if (incoming == null) {
            return output;
        }

        incoming.forEach((key, value) -> {
            Object current = output.get(key);
            if (LEGAL_ENTITY.equals(key)) {
                output.put(key, mergeLegalEntity(current, value));
            } else if (value instanceof Map && current instanceof Map) {
                output.put(key, deepMerge(MerchantProfile.asMap(current), MerchantProfile.asMap(value)));
            } else {
                output.put(key, value);
            }
        });
        return output;
    }

    private static Object mergeLegalEntity(Object existing, Object incoming) {
        if (existing == null) return incoming;
        if (incoming == null) return existing;
        if (!(existing instanceof Map) || !(incoming instanceof Map)) return incoming;

        Map<String, Object> existingEntity = MerchantProfile.asMap(existing);
        Map<String, Object> incomingEntity = MerchantProfile.asMap(incoming);
        if (!Objects.equals(existingEntity.get("type"), incomingEntity.get("type"))) {
            return incomingEntity;
        }
        return deepMerge(existingEntity, incomingEntity);
    }
}
