package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.NotificationCategory;
import com.aigreentick.services.merchantonboarding.dto.webhook.NormalizedBatch;
import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;
import com.aigreentick.services.merchantonboarding.exception.InvalidRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookPayloadNormalizerTest {

    private static final String CLASSIC_ITEM = "{\"pspReference\":\"PSP1\",\"eventCode\":\"AUTHORISATION\","
            + "\"merchantAccountCode\":\"AcmeMerchant\",\"merchantReference\":\"order-1\","
            + "\"amount\":{\"value\":1000,\"currency\":\"EUR\"},\"success\":\"true\"}";

    private final WebhookPayloadNormalizer normalizer = new WebhookPayloadNormalizer(new ObjectMapper());

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"notificationItems\":[{\"NotificationRequestItem\":" + CLASSIC_ITEM + "}]}",
            "{\"notifications\":[" + CLASSIC_ITEM + "]}",
            "{\"items\":[{\"item\":" + CLASSIC_ITEM + "}]}",
            "[" + CLASSIC_ITEM + "]",
            "{\"NotificationRequestItem\":" + CLASSIC_ITEM + "}",
            "{\"notification\":" + CLASSIC_ITEM + "}",
            "{\"item\":" + CLASSIC_ITEM + "}",
            CLASSIC_ITEM
    })
    void normalize_everyShapeYieldsTheSameNotification(String body) {
        NormalizedBatch batch = normalizer.normalize(body);

        assertThat(batch.hasErrors()).isFalse();
        assertThat(batch.received()).isEqualTo(1);
        assertThat(batch.notifications()).hasSize(1);
        WebhookNotification notification = batch.notifications().get(0);
        assertThat(notification.pspReference()).isEqualTo("PSP1");
        assertThat(notification.eventCode()).isEqualTo("AUTHORISATION");
        assertThat(notification.merchantAccountCode()).isEqualTo("AcmeMerchant");
        assertThat(notification.merchantReference()).isEqualTo("order-1");
        assertThat(notification.amountValue()).isEqualTo("1000");
        assertThat(notification.amountCurrency()).isEqualTo("EUR");
        assertThat(notification.nativePspReference()).isTrue();
        assertThat(notification.balancePlatform()).isFalse();
    }

    @Test
    void normalize_recognizesShapeInPriorityOrder() {
        NormalizedBatch batch = normalizer.normalize(
                "{\"notificationItems\":[" + CLASSIC_ITEM + "],\"notifications\":[" + CLASSIC_ITEM + "," + CLASSIC_ITEM + "]}");

        assertThat(batch.shape()).isEqualTo("notificationItems[]");
        assertThat(batch.received()).isEqualTo(1);
    }

    @Test
    void normalize_balancePlatformEventUsesFallbackFields() {
        String body = "{\"type\":\"balancePlatform.accountHolder.updated\",\"timestamp\":\"2024-05-01T10:00:00Z\","
                + "\"data\":{\"balancePlatform\":\"AcmePlatform\",\"id\":\"EVT1\","
                + "\"accountHolder\":{\"id\":\"AH1\"}}}";

        WebhookNotification notification = normalizer.normalize(body).notifications().get(0);

        assertThat(notification.eventCode()).isEqualTo("balancePlatform.accountHolder.updated");
        assertThat(notification.pspReference()).isEqualTo("EVT1");
        assertThat(notification.nativePspReference()).isFalse();
        assertThat(notification.merchantAccountCode()).isEqualTo("AcmePlatform");
        assertThat(notification.merchantReference()).isEqualTo("AH1");
        assertThat(notification.accountHolderId()).isEqualTo("AH1");
        assertThat(notification.eventDate()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(notification.success()).isEqualTo("true");
        assertThat(notification.balancePlatform()).isTrue();
        assertThat(notification.category()).isEqualTo(NotificationCategory.BALANCE_PLATFORM);
        assertThat(notification.isAccountHolderEvent()).isTrue();
        assertThat(notification.dedupKey())
                .isEqualTo("EVT1:balancePlatform.accountHolder.updated:2024-05-01T10:00:00Z");
    }

    @Test
    void normalize_missingValuesDefaultToUnknown() {
        WebhookNotification notification = normalizer.normalize("{\"id\":\"X1\"}").notifications().get(0);

        assertThat(notification.pspReference()).isEqualTo("X1");
        assertThat(notification.eventCode()).isEqualTo("unknown");
        assertThat(notification.merchantAccountCode()).isEqualTo("unknown");
        assertThat(notification.merchantReference()).isEqualTo("unknown");
        assertThat(notification.category()).isEqualTo(NotificationCategory.STANDARD);
    }

    @Test
    void normalize_itemWithoutAnyReferenceIsReportedByPosition() {
        NormalizedBatch batch = normalizer.normalize(
                "{\"notificationItems\":[" + CLASSIC_ITEM + ",{\"eventCode\":\"AUTHORISATION\"}]}");

        assertThat(batch.received()).isEqualTo(2);
        assertThat(batch.notifications()).hasSize(1);
        assertThat(batch.errors()).containsExactly("Notification item 2 missing required fields");
        assertThat(batch.hasErrors()).isTrue();
    }

    @Test
    void normalize_readsSignatureFromAdditionalData() {
        String body = "{\"pspReference\":\"PSP2\",\"eventCode\":\"REFUND\","
                + "\"additionalData\":{\"hmacSignature\":\"c2lnbmF0dXJl\"}}";

        WebhookNotification notification = normalizer.normalize(body).notifications().get(0);

        assertThat(notification.hmacSignature()).isEqualTo("c2lnbmF0dXJl");
        assertThat(notification.dedupKey()).isEqualTo("PSP2");
    }

    @Test
    void normalize_rejectsBlankBody() {
        assertThatThrownBy(() -> normalizer.normalize("  "))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Missing request body");
    }

    @Test
    void normalize_rejectsMalformedJson() {
        assertThatThrownBy(() -> normalizer.normalize("{\"notificationItems\": ["))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Request body is not valid JSON");
    }

    @Test
    void normalize_rejectsScalarBody() {
        assertThatThrownBy(() -> normalizer.normalize("42"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Invalid webhook payload structure");
    }

    @Test
    void normalize_rejectsEmptyBatch() {
        assertThatThrownBy(() -> normalizer.normalize("{\"notificationItems\":[]}"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("No valid notification items found in payload");
    }
}
