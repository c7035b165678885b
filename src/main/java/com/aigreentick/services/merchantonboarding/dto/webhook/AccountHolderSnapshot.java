package com.aigreentick.services.merchantonboarding.dto.webhook;

import com.aigreentick.services.merchantonboarding.constants.Capability;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What the verification state machine needs from an account holder notification.
 *
 * @param validCapabilities        capabilities reporting verificationStatus "valid"
 * @param transferInstrumentId     first transfer instrument found across the capabilities, in
 *                                 {@link Capability} order; null if none
 */
public record AccountHolderSnapshot(
        String accountHolderId,
        String legalEntityId,
        Set<Capability> validCapabilities,
        String transferInstrumentId
) {

    public AccountHolderSnapshot {
        validCapabilities = validCapabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(validCapabilities));
    }

    public static AccountHolderSnapshot idOnly(String accountHolderId) {
        return new AccountHolderSnapshot(accountHolderId, null, EnumSet.noneOf(Capability.class), null);
    }

    /**
     * Reads {@code {id, legalEntityId, capabilities: {<key>: {verificationStatus, transferInstruments: [{id}]}}}}.
     */
    public static AccountHolderSnapshot from(JsonNode accountHolder) {
        Set<Capability> valid = EnumSet.noneOf(Capability.class);
        String transferInstrumentId = null;

        JsonNode capabilities = accountHolder.path("capabilities");
        for (Capability capability : Capability.values()) {
            JsonNode entry = capabilities.path(capability.getKey());
            if (!entry.isObject()) {
                continue;
            }
            if (Capability.VERIFICATION_VALID.equals(entry.path("verificationStatus").asText(null))) {
                valid.add(capability);
            }
            JsonNode instruments = entry.path("transferInstruments");
            if (transferInstrumentId == null && instruments.isArray() && instruments.size() > 0) {
                transferInstrumentId = textOrNull(instruments.get(0).path("id"));
            }
        }

        return new AccountHolderSnapshot(
                textOrNull(accountHolder.path("id")),
                textOrNull(accountHolder.path("legalEntityId")),
                valid,
                transferInstrumentId);
    }

    public boolean hasCapabilities() {
        return !validCapabilities.isEmpty() || transferInstrumentId != null;
    }

    private static String textOrNull(JsonNode node) {
        if (!node.isValueNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }
}
