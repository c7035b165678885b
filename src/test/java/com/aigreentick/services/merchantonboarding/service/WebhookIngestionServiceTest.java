package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.NotificationCategory;
import com.aigreentick.services.merchantonboarding.dto.response.WebhookAcceptedResponse;
import com.aigreentick.services.merchantonboarding.dto.webhook.WebhookNotification;
import com.aigreentick.services.merchantonboarding.event.EventBus;
import com.aigreentick.services.merchantonboarding.event.PlatformWebhookEvent;
import com.aigreentick.services.merchantonboarding.exception.BlobStorageException;
import com.aigreentick.services.merchantonboarding.exception.WebhookAuthenticationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookIngestionServiceTest {

    private static final String TWO_ITEMS = "{\"notificationItems\":["
            + "{\"NotificationRequestItem\":{\"pspReference\":\"PSP1\",\"eventCode\":\"AUTHORISATION\"}},"
            + "{\"NotificationRequestItem\":{\"pspReference\":\"PSP2\",\"eventCode\":\"TRANSFER_FUNDS\"}}]}";

    @Mock
    private HmacSignatureValidator signatureValidator;

    @Mock
    private BlobStore blobStore;

    @Mock
    private WebhookDeduplicator deduplicator;

    @Mock
    private EventBus eventBus;

    private WebhookIngestionService service;

    @BeforeEach
    void setUp() {
        service = new WebhookIngestionService(new WebhookPayloadNormalizer(new ObjectMapper()),
                signatureValidator, blobStore, deduplicator, eventBus);
    }

    @Test
    void ingest_storesPayloadThenPublishesEveryItem() {
        when(signatureValidator.validate(any())).thenReturn(List.of());
        when(deduplicator.claim(any(WebhookNotification.class), anyString())).thenReturn(true);

        WebhookAcceptedResponse response = service.ingest(TWO_ITEMS);

        assertThat(response.getReceived()).isEqualTo(2);
        assertThat(response.getPublished()).isEqualTo(2);
        assertThat(response.getDuplicates()).isZero();
        verify(blobStore).put(startsWith("platform-webhooks/"), eq("application/json"), eq(TWO_ITEMS));

        ArgumentCaptor<PlatformWebhookEvent> events = ArgumentCaptor.forClass(PlatformWebhookEvent.class);
        verify(eventBus, times(2)).publish(events.capture());
        assertThat(events.getAllValues())
                .extracting(PlatformWebhookEvent::category)
                .containsExactly(NotificationCategory.STANDARD, NotificationCategory.TRANSFER);
        assertThat(events.getAllValues())
                .allSatisfy(event -> {
                    assertThat(event.webhookId()).isEqualTo(response.getWebhookId());
                    assertThat(event.blobKey()).endsWith(response.getWebhookId() + ".json");
                });
    }

    @Test
    void ingest_rejectedBatchStoresAndPublishesNothing() {
        when(signatureValidator.validate(any()))
                .thenReturn(List.of("Invalid HMAC signature for PSP reference: PSP2"));

        assertThatThrownBy(() -> service.ingest(TWO_ITEMS))
                .isInstanceOf(WebhookAuthenticationException.class)
                .satisfies(e -> assertThat(((WebhookAuthenticationException) e).getErrors())
                        .containsExactly("Invalid HMAC signature for PSP reference: PSP2"));

        verifyNoInteractions(blobStore, deduplicator, eventBus);
    }

    @Test
    void ingest_itemMissingFieldsRejectsWholeBatch() {
        when(signatureValidator.validate(any())).thenReturn(List.of());
        String body = "{\"notificationItems\":[{\"pspReference\":\"PSP1\",\"eventCode\":\"AUTHORISATION\"},"
                + "{\"eventCode\":\"AUTHORISATION\"}]}";

        assertThatThrownBy(() -> service.ingest(body))
                .isInstanceOf(WebhookAuthenticationException.class)
                .satisfies(e -> assertThat(((WebhookAuthenticationException) e).getErrors())
                        .containsExactly("Notification item 2 missing required fields"));

        verifyNoInteractions(blobStore, eventBus);
    }

    @Test
    void ingest_blobFailurePublishesNothing() {
        when(signatureValidator.validate(any())).thenReturn(List.of());
        doThrow(new BlobStorageException("Failed to store webhook payload", new RuntimeException("disk")))
                .when(blobStore).put(anyString(), anyString(), anyString());

        assertThatThrownBy(() -> service.ingest(TWO_ITEMS)).isInstanceOf(BlobStorageException.class);

        verifyNoInteractions(deduplicator, eventBus);
    }

    @Test
    void ingest_duplicatesAreCountedNotPublished() {
        when(signatureValidator.validate(any())).thenReturn(List.of());
        when(deduplicator.claim(any(WebhookNotification.class), anyString())).thenReturn(false, true);

        WebhookAcceptedResponse response = service.ingest(TWO_ITEMS);

        assertThat(response.getPublished()).isEqualTo(1);
        assertThat(response.getDuplicates()).isEqualTo(1);
        verify(eventBus, times(1)).publish(any());
    }

    @Test
    void ingest_publishFailureReleasesClaimWithoutFailingBatch() {
        when(signatureValidator.validate(any())).thenReturn(List.of());
        when(deduplicator.claim(any(WebhookNotification.class), anyString())).thenReturn(true);
        doThrow(new IllegalStateException("listener down")).doNothing().when(eventBus).publish(any());

        WebhookAcceptedResponse response = service.ingest(TWO_ITEMS);

        assertThat(response.getReceived()).isEqualTo(2);
        assertThat(response.getPublished()).isEqualTo(1);
        verify(eventBus, times(2)).publish(any());
        ArgumentCaptor<WebhookNotification> released = ArgumentCaptor.forClass(WebhookNotification.class);
        verify(deduplicator).release(released.capture());
        assertThat(released.getValue().pspReference()).isEqualTo("PSP1");
    }

    @Test
    void ingest_releaseFailureIsLoggedNotThrown() {
        when(signatureValidator.validate(any())).thenReturn(List.of());
        when(deduplicator.claim(any(WebhookNotification.class), anyString())).thenReturn(true);
        doThrow(new IllegalStateException("listener down")).when(eventBus).publish(any());
        doThrow(new IllegalStateException("db down")).when(deduplicator).release(any());

        WebhookAcceptedResponse response = service.ingest(TWO_ITEMS);

        assertThat(response.getPublished()).isZero();
        verify(deduplicator, times(2)).release(any());
    }

    @Test
    void ingest_emptyBatchNeverReachesSignatureCheck() {
        assertThatThrownBy(() -> service.ingest("{\"notificationItems\":[]}"))
                .hasMessage("No valid notification items found in payload");

        verifyNoInteractions(signatureValidator, blobStore, eventBus);
        verify(deduplicator, never()).claim(any(), anyString());
    }

    @Test
    void blobKey_isPartitionedByYearAndMonth() {
        assertThat(WebhookIngestionService.blobKey("abc", LocalDate.of(2024, 3, 9)))
                .isEqualTo("platform-webhooks/2024/03/abc.json");
    }
}
