package com.aigreentick.services.merchantonboarding.service;

import java.util.List;
import java.util.Map;

/**
 * Pulls the tax identifier out of a legal entity as returned by the platform.
 * Paths are tried in order; the first non-blank scalar wins.
 */
public final class TaxIdentifierExtractor {

    private static final Object[][] TIN_PATHS = {
            {"organization", "taxId"},
            {"individual", "identificationData", "number"},
            {"organization", "taxInformation", 0, "number"},
            {"organization", "businessInformation", "taxInformation", "number"},
            {"individual", "taxInformation", "number"},
            {"individual", "businessInformation", "taxInformation", "number"}
    };

    private TaxIdentifierExtractor() {
    }

    public static String extract(Map<String, Object> legalEntity) {
        if (legalEntity == null) {
            return null;
        }
        for (Object[] path : TIN_PATHS) {
            Object value = resolve(legalEntity, path);
            if (value != null && !(value instanceof Map) && !(value instanceof List)
                    && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    private static Object resolve(Object node, Object[] path) {
        Object current = node;
        for (Object segment : path) {
            if (segment instanceof Integer) {
                if (!(current instanceof List) || ((List<?>) current).size() <= (Integer) segment) {
                    return null;
                }
                current = ((List<?>) current).get((Integer) segment);
            } else {
                if (!(current instanceof Map)) {
                    return null;
                }
                current = ((Map<?, ?>) current).get(segment);
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
