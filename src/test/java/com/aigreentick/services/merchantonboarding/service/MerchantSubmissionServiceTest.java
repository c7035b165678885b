package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.constants.OnboardingStatus;
import com.aigreentick.services.merchantonboarding.dto.request.MerchantSubmissionRequest;
import com.aigreentick.services.merchantonboarding.dto.response.MerchantSubmissionResponse;
import com.aigreentick.services.merchantonboarding.entity.MerchantOnboardingRecord;
import com.aigreentick.services.merchantonboarding.exception.InvalidRequestException;
import com.aigreentick.services.merchantonboarding.exception.MerchantNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MerchantSubmissionServiceTest {

    private static final String MERCHANT_ID = "merchant-7";

    @Mock
    private MerchantRecordStore recordStore;

    private MerchantSubmissionService service;

    @BeforeEach
    void setUp() {
        service = new MerchantSubmissionService(recordStore);
    }

    @Test
    void submit_firstSubmissionCreatesRecord() {
        when(recordStore.get(MERCHANT_ID)).thenReturn(Optional.empty());
        MerchantSubmissionRequest request = request(Map.of("legalEntity", Map.of("type", "organization")));

        String message = service.submit(MERCHANT_ID, request);

        assertThat(message).isEqualTo(OnboardingConstants.SUCCESS_SUBMISSION_STORED);
        ArgumentCaptor<MerchantOnboardingRecord> captor = ArgumentCaptor.forClass(MerchantOnboardingRecord.class);
        verify(recordStore).create(captor.capture());
        MerchantOnboardingRecord created = captor.getValue();
        assertThat(created.getMerchantId()).isEqualTo(MERCHANT_ID);
        assertThat(created.getSubmissionCount()).isEqualTo(1);
        assertThat(created.isHasGeneratedLink()).isFalse();
        assertThat(created.getStatus()).isEqualTo(OnboardingStatus.SUBMITTED);
        assertThat(created.getUserEmail()).isEqualTo("owner@clinic.example");
    }

    @Test
    void submit_storeReferenceMakesRecordReadyForPlatform() {
        when(recordStore.get(MERCHANT_ID)).thenReturn(Optional.empty());

        service.submit(MERCHANT_ID, request(Map.of("store", Map.of("reference", "store-1"))));

        ArgumentCaptor<MerchantOnboardingRecord> captor = ArgumentCaptor.forClass(MerchantOnboardingRecord.class);
        verify(recordStore).create(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(OnboardingStatus.READY_FOR_PLATFORM);
    }

    @Test
    void submit_laterSubmissionDeepMerges() {
        MerchantOnboardingRecord record = existing(false);
        when(recordStore.get(MERCHANT_ID)).thenReturn(Optional.of(record));
        stubUpdateAppliesTo(record);

        String message = service.submit(MERCHANT_ID, request(Map.of("store", Map.of("reference", "store-1"))));

        assertThat(message).isEqualTo(OnboardingConstants.SUCCESS_SUBMISSION_UPDATED);
        assertThat(record.getMerchantData())
                .containsEntry("legalEntity", Map.of("type", "organization"))
                .containsEntry("store", Map.of("reference", "store-1"));
        assertThat(record.getSubmissionCount()).isEqualTo(2);
        assertThat(record.getStatus()).isEqualTo(OnboardingStatus.READY_FOR_PLATFORM);
    }

    @Test
    void submit_profileFrozenAfterLinkGeneration() {
        MerchantOnboardingRecord record = existing(true);
        when(recordStore.get(MERCHANT_ID)).thenReturn(Optional.of(record));
        stubUpdateAppliesTo(record);

        String message = service.submit(MERCHANT_ID, request(Map.of("legalEntity", Map.of("type", "individual"))));

        assertThat(message).isEqualTo(OnboardingConstants.SUCCESS_SUBMISSION_IGNORED);
        assertThat(record.getMerchantData()).containsEntry("legalEntity", Map.of("type", "organization"));
        assertThat(record.getSubmissionCount()).isEqualTo(1);
    }

    @Test
    void submit_agreementOnlyIsAcceptedAfterLinkGeneration() {
        MerchantOnboardingRecord record = existing(true);
        when(recordStore.get(MERCHANT_ID)).thenReturn(Optional.of(record));
        stubUpdateAppliesTo(record);
        MerchantSubmissionRequest request = MerchantSubmissionRequest.builder()
                .userEmail("owner@clinic.example")
                .agreementTimestamp("2024-05-01T10:15:30Z")
                .build();

        String message = service.submit(MERCHANT_ID, request);

        assertThat(message).isEqualTo(OnboardingConstants.SUCCESS_SUBMISSION_UPDATED);
        assertThat(record.getAgreementTimestamp()).isEqualTo("2024-05-01T10:15:30Z");
    }

    @Test
    void submit_concurrentFirstSubmissionFallsBackToMerge() {
        MerchantOnboardingRecord record = existing(false);
        when(recordStore.get(MERCHANT_ID)).thenReturn(Optional.empty());
        when(recordStore.create(any())).thenThrow(new DataIntegrityViolationException("uq_merchant_onboarding_merchant"));
        stubUpdateAppliesTo(record);

        String message = service.submit(MERCHANT_ID, request(Map.of("store", Map.of("reference", "store-1"))));

        assertThat(message).isEqualTo(OnboardingConstants.SUCCESS_SUBMISSION_UPDATED);
        assertThat(record.getSubmissionCount()).isEqualTo(2);
    }

    @Test
    void submit_statusNeverRegresses() {
        MerchantOnboardingRecord record = existing(false);
        record.setStatus(OnboardingStatus.ONBOARDED);
        when(recordStore.get(MERCHANT_ID)).thenReturn(Optional.of(record));
        stubUpdateAppliesTo(record);

        service.submit(MERCHANT_ID, request(Map.of("legalEntity", Map.of("type", "organization"))));

        assertThat(record.getStatus()).isEqualTo(OnboardingStatus.ONBOARDED);
    }

    @Test
    void submit_nullBodyIsRejected() {
        assertThatThrownBy(() -> service.submit(MERCHANT_ID, null))
                .isInstanceOf(InvalidRequestException.class);
        verify(recordStore, never()).get(any());
    }

    @Test
    void getSubmission_hidesTaxIdentifier() {
        MerchantOnboardingRecord record = existing(false);
        record.setPmbData(new HashMap<>(Map.of("tin", "12-3456789", "practiceName", "Acme Dental")));
        when(recordStore.getOrThrow(MERCHANT_ID)).thenReturn(record);

        MerchantSubmissionResponse response = service.getSubmission(MERCHANT_ID);

        assertThat(response.getPmbData()).containsOnlyKeys("practiceName");
        assertThat(record.getPmbData()).containsKey("tin");
        assertThat(response.getStatus()).isEqualTo(OnboardingStatus.SUBMITTED);
    }

    @Test
    void getSubmission_unknownMerchant() {
        when(recordStore.getOrThrow(MERCHANT_ID)).thenThrow(MerchantNotFoundException.withMerchantId(MERCHANT_ID));

        assertThatThrownBy(() -> service.getSubmission(MERCHANT_ID)).isInstanceOf(MerchantNotFoundException.class);
    }

    // ────────────────────────────────────────────────────────────

    private void stubUpdateAppliesTo(MerchantOnboardingRecord record) {
        when(recordStore.update(eq(MERCHANT_ID), any())).thenAnswer(invocation -> {
            Function<MerchantOnboardingRecord, Object> mutator = invocation.getArgument(1);
            return mutator.apply(record);
        });
    }

    private static MerchantSubmissionRequest request(Map<String, Object> merchantData) {
        return MerchantSubmissionRequest.builder()
                .merchantData(merchantData)
                .userEmail("owner@clinic.example")
                .build();
    }

    private static MerchantOnboardingRecord existing(boolean linkGenerated) {
        return MerchantOnboardingRecord.builder()
                .merchantId(MERCHANT_ID)
                .merchantData(Map.of("legalEntity", Map.of("type", "organization")))
                .status(OnboardingStatus.SUBMITTED)
                .submissionCount(1)
                .hasGeneratedLink(linkGenerated)
                .build();
    }
}
