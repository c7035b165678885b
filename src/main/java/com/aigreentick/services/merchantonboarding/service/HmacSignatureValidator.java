package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;
import com.aigreentick.services.merchantonboarding.exception.SecretResolutionException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;

import static com.aigreentick.services.merchantonboarding.service.WebhookPayloadNormalizer.text;

/**
 * HMAC-SHA256 verification of classic platform notifications.
 *
 * Signed string (colon-joined, absent fields as empty):
 *   pspReference : originalReference("") : merchantAccountCode : merchantReference
 *   : amount.value ("0") : amount.currency ("USD") : eventCode : success ("true")
 *
 * The key is the hex-decoded {@code webhook-hmac-key} secret; the signature is the Base64 digest
 * carried in {@code additionalData.hmacSignature}. Balance-platform notifications are not signed
 * this way and are skipped. The key is resolved for every batch, so a missing or malformed
 * secret fails the request even when no item needs it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HmacSignatureValidator {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretStore secretStore;

    /**
     * @return one error message per notification that fails verification; empty if all pass
     */
    public List<String> validate(List<WebhookNotification> notifications) {
        List<String> errors = new ArrayList<>();
        byte[] key = resolveKey();

        for (WebhookNotification notification : notifications) {
            if (notification.balancePlatform()) {
                continue;
            }
            String signature = notification.hmacSignature();
            if (signature == null) {
                errors.add("Missing HMAC signature for PSP reference: " + notification.pspReference());
                continue;
            }
            if (!isValid(notification.item(), signature, key)) {
                log.warn("HMAC mismatch: pspReference={}, eventCode={}",
                        notification.pspReference(), notification.eventCode());
                errors.add("Invalid HMAC signature for PSP reference: " + notification.pspReference());
            }
        }
        return errors;
    }

    boolean isValid(JsonNode item, String signature, byte[] key) {
        byte[] expected = sign(signingString(item), key).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
    }

    static String signingString(JsonNode item) {
        JsonNode amount = item.path("amount");
        return String.join(":",
                orEmpty(text(item, "pspReference")),
                "",
                orEmpty(text(item, "merchantAccountCode")),
                orEmpty(text(item, "merchantReference")),
                orDefault(text(amount, "value"), "0"),
                orDefault(text(amount, "currency"), "USD"),
                orEmpty(text(item, "eventCode")),
                orDefault(text(item, "success"), "true"));
    }

    static String sign(String payload, byte[] key) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private byte[] resolveKey() {
        String hexKey = secretStore.resolve(OnboardingConstants.SECRET_WEBHOOK_HMAC_KEY).trim();
        try {
            return HexFormat.of().parseHex(hexKey);
        } catch (IllegalArgumentException e) {
            throw new SecretResolutionException("Secret '" + OnboardingConstants.SECRET_WEBHOOK_HMAC_KEY
                    + "' is not a hex-encoded key");
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
