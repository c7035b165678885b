package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.exception.OnboardingValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over a stored merchantData document.
 *
 * {@code store} is accepted either as a single object or as an array of objects;
 * {@link #stores()} always returns a list.
 */
public final class MerchantProfile {

    private final Map<String, Object> merchantData;

    private MerchantProfile(Map<String, Object> merchantData) {
        this.merchantData = merchantData != null ? merchantData : Map.of();
    }

    public static MerchantProfile of(Map<String, Object> merchantData) {
        return new MerchantProfile(merchantData);
    }

    /**
     * Checks the fields the onboarding saga cannot run without.
     *
     * @throws OnboardingValidationException naming the first missing field
     */
    public void validateForOnboarding() {
        if (legalEntity() == null) {
            throw OnboardingValidationException.missingField("legalEntity");
        }
        if (merchantData.get("store") == null) {
            throw OnboardingValidationException.missingField("store");
        }
        List<Map<String, Object>> stores = stores();
        if (stores.isEmpty()) {
            throw OnboardingValidationException.emptyStores();
        }
        for (int i = 0; i < stores.size(); i++) {
            if (isBlank(stores.get(i).get("phoneNumber"))) {
                throw OnboardingValidationException.missingStoreField("phoneNumber", i);
            }
        }
    }

    public Map<String, Object> legalEntity() {
        return asMap(merchantData.get("legalEntity"));
    }

    public boolean isIndividual() {
        Map<String, Object> legalEntity = legalEntity();
        return legalEntity != null
                && OnboardingConstants.LEGAL_ENTITY_TYPE_INDIVIDUAL.equals(legalEntity.get("type"));
    }

    public String providerGroupName() {
        Map<String, Object> legalEntity = legalEntity();
        Object name = legalEntity != null ? legalEntity.get("providerGroupName") : null;
        return name != null ? String.valueOf(name) : null;
    }

    public List<Map<String, Object>> stores() {
        Object store = merchantData.get("store");
        if (store instanceof Map) {
            return List.of(asMap(store));
        }
        if (store instanceof List) {
            List<Map<String, Object>> stores = new ArrayList<>();
            for (Object item : (List<?>) store) {
                Map<String, Object> map = asMap(item);
                stores.add(map != null ? map : Map.of());
            }
            return Collections.unmodifiableList(stores);
        }
        return List.of();
    }

    /** The store the saga registers on the platform. */
    public Map<String, Object> primaryStore() {
        List<Map<String, Object>> stores = stores();
        return stores.isEmpty() ? null : stores.get(0);
    }

    /**
     * True when any store carries a non-blank reference. A submission with a store
     * reference is ready to be pushed to the platform.
     */
    public boolean hasStoreReference() {
        return stores().stream().anyMatch(store -> !isBlank(store.get("reference")));
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private static boolean isBlank(Object value) {
        return value == null || String.valueOf(value).isBlank();
    }
}
