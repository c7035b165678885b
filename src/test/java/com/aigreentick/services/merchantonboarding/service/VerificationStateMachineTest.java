package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.client.PlatformApiClient;
import com.aigreentick.services.merchantonboarding.constants.Capability;
import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.constants.OnboardingStatus;
import com.aigreentick.services.merchantonboarding.dto.response.PlatformApiResponse;
import com.aigreentick.services.merchantonboarding.dto.response.VerificationResult;
import com.aigreentick.services.merchantonboarding.dto.response.VerificationResult.Outcome;
import com.aigreentick.services.merchantonboarding.dto.webhook.AccountHolderSnapshot;
import com.aigreentick.services.merchantonboarding.entity.CreationProgress;
import com.aigreentick.services.merchantonboarding.entity.MerchantOnboardingRecord;
import com.aigreentick.services.merchantonboarding.entity.VerificationStatuses;
import com.aigreentick.services.merchantonboarding.exception.PlatformApiException;
import com.aigreentick.services.merchantonboarding.service.VerificationStateMachine.Variant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationStateMachineTest {

    private static final String MERCHANT_ID = "merchant-7";
    private static final String ACCOUNT_HOLDER_ID = "AH3227C223222C5GXQXF658WB";
    private static final String UPDATED = OnboardingConstants.EVENT_ACCOUNT_HOLDER_UPDATED;
    private static final String CREATED = OnboardingConstants.EVENT_ACCOUNT_HOLDER_CREATED;

    @Mock
    private MerchantRecordStore recordStore;

    @Mock
    private PlatformApiClient platformApiClient;

    private VerificationStateMachine stateMachine;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        stateMachine = new VerificationStateMachine(recordStore, platformApiClient);
    }

    @Test
    void process_unknownAccountHolderIsANoOp() {
        when(recordStore.findByAccountHolderId(ACCOUNT_HOLDER_ID)).thenReturn(Optional.empty());

        VerificationResult result = stateMachine.process(Variant.WEBHOOK, UPDATED, allValid("TI1"));

        assertThat(result.getOutcome()).isEqualTo(Outcome.NO_MATCHING_MERCHANT);
        verifyNoInteractions(platformApiClient);
        verify(recordStore, never()).update(anyString(), any());
    }

    @Test
    void process_allVerifiedCreatesSweepAndOnboardsOnce() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        when(platformApiClient.createSweep("BA1", "TI1")).thenReturn(PlatformApiResponse.of(Map.of("id", "SWPC1")));

        VerificationResult result = stateMachine.process(Variant.WEBHOOK, UPDATED, allValid("TI1"));

        assertThat(result.getOutcome()).isEqualTo(Outcome.PROCESSED);
        assertThat(result.isAllVerified()).isTrue();
        assertThat(result.isSweepCreated()).isTrue();
        assertThat(result.isOnboarded()).isTrue();
        assertThat(record.getStatus()).isEqualTo(OnboardingStatus.ONBOARDED);
        assertThat(record.getOnboardedAt()).isNotNull();
        assertThat(record.getCreationProgress().getSweepId()).isEqualTo("SWPC1");
        assertThat(record.getCreationProgress().getTransferInstrumentId()).isEqualTo("TI1");
        assertThat(record.getVerificationStatuses().allVerified()).isTrue();
    }

    @Test
    void process_repeatedEventAfterOnboardingMakesNoCallsAndNoWrites() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        when(platformApiClient.createSweep("BA1", "TI1")).thenReturn(PlatformApiResponse.of(Map.of("id", "SWPC1")));

        stateMachine.process(Variant.WEBHOOK, UPDATED, allValid("TI1"));
        VerificationResult second = stateMachine.process(Variant.WEBHOOK, UPDATED, allValid("TI1"));

        assertThat(second.isOnboarded()).isFalse();
        verify(platformApiClient, times(1)).createSweep(anyString(), anyString());
        verify(recordStore, times(1)).update(eq(MERCHANT_ID), any());
    }

    @Test
    void process_partialVerificationPersistsFlagsWithoutSweep() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        AccountHolderSnapshot snapshot = new AccountHolderSnapshot(ACCOUNT_HOLDER_ID, null,
                EnumSet.of(Capability.RECEIVE_PAYMENTS, Capability.SEND_TO_TRANSFER_INSTRUMENT), "TI1");

        VerificationResult result = stateMachine.process(Variant.WEBHOOK, UPDATED, snapshot);

        assertThat(result.isAllVerified()).isFalse();
        assertThat(result.isOnboarded()).isFalse();
        assertThat(record.getVerificationStatuses().isVerified(Capability.RECEIVE_PAYMENTS)).isTrue();
        assertThat(record.getVerificationStatuses().isVerified(Capability.RECEIVE_FROM_PLATFORM_PAYMENTS)).isFalse();
        assertThat(record.getCreationProgress().getTransferInstrumentId()).isEqualTo("TI1");
        assertThat(record.getStatus()).isEqualTo(OnboardingStatus.READY_FOR_PLATFORM);
        verify(platformApiClient, never()).createSweep(anyString(), anyString());
    }

    @Test
    void process_flagsAreNeverCleared() {
        VerificationStatuses flags = new VerificationStatuses();
        flags.markVerified(Capability.RECEIVE_PAYMENTS);
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), flags);
        givenRecord(record);
        stubUpdateAppliesTo(record);
        AccountHolderSnapshot snapshot = new AccountHolderSnapshot(ACCOUNT_HOLDER_ID, null,
                EnumSet.of(Capability.SEND_TO_BALANCE_ACCOUNT), null);

        stateMachine.process(Variant.WEBHOOK, UPDATED, snapshot);

        assertThat(record.getVerificationStatuses().isVerified(Capability.RECEIVE_PAYMENTS)).isTrue();
        assertThat(record.getVerificationStatuses().isVerified(Capability.SEND_TO_BALANCE_ACCOUNT)).isTrue();
    }

    @Test
    void process_sweepFailureLeavesMerchantNotOnboarded() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        when(platformApiClient.createSweep("BA1", "TI1"))
                .thenThrow(PlatformApiException.failed("create sweep", 500, "Internal error"));

        VerificationResult result = stateMachine.process(Variant.WEBHOOK, UPDATED, allValid("TI1"));

        assertThat(result.getOutcome()).isEqualTo(Outcome.PROCESSED);
        assertThat(result.isSweepCreated()).isFalse();
        assertThat(result.isOnboarded()).isFalse();
        assertThat(record.getCreationProgress().getSweepId()).isNull();
        assertThat(record.getStatus()).isNotEqualTo(OnboardingStatus.ONBOARDED);
        assertThat(record.getVerificationStatuses().allVerified()).isTrue();
    }

    @Test
    void process_existingSweepOnboardsWithoutNewSweep() {
        CreationProgress progress = progressWithBalanceAccount();
        progress.setTransferInstrumentId("TI1");
        progress.setSweepId("SWPC_OLD");
        MerchantOnboardingRecord record = record(progress, new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);

        VerificationResult result = stateMachine.process(Variant.WEBHOOK, UPDATED, allValid(null));

        assertThat(result.isOnboarded()).isTrue();
        assertThat(record.getCreationProgress().getSweepId()).isEqualTo("SWPC_OLD");
        verify(platformApiClient, never()).createSweep(anyString(), anyString());
    }

    @Test
    void process_missingBalanceAccountBlocksSweep() {
        MerchantOnboardingRecord record = record(new CreationProgress(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);

        VerificationResult result = stateMachine.process(Variant.WEBHOOK, UPDATED, allValid("TI1"));

        assertThat(result.isAllVerified()).isTrue();
        assertThat(result.isOnboarded()).isFalse();
        verify(platformApiClient, never()).createSweep(anyString(), anyString());
    }

    @Test
    void process_webhookVariantDoesNotNeedTaxIdentifier() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        when(platformApiClient.createSweep("BA1", "TI1")).thenReturn(PlatformApiResponse.of(Map.of("id", "SWPC1")));

        VerificationResult result = stateMachine.process(Variant.WEBHOOK, UPDATED, allValid("TI1"));

        assertThat(result.isOnboarded()).isTrue();
        assertThat(record.getTaxIdentifier()).isNull();
        verify(platformApiClient, never()).getLegalEntity(anyString());
    }

    @Test
    void process_completionVariantFetchesTaxIdentifierBeforeSweep() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        when(platformApiClient.getLegalEntity("LE1")).thenReturn(PlatformApiResponse.of(
                Map.of("organization", Map.of("taxId", "12-3456789"))));
        when(platformApiClient.createSweep("BA1", "TI1")).thenReturn(PlatformApiResponse.of(Map.of("id", "SWPC1")));

        VerificationResult result = stateMachine.process(Variant.COMPLETION, UPDATED, allValid("TI1"));

        assertThat(result.isOnboarded()).isTrue();
        assertThat(record.getTaxIdentifier()).isEqualTo("12-3456789");
        assertThat(record.getCreationProgress().getSweepId()).isEqualTo("SWPC1");
    }

    @Test
    void process_completionVariantPrefersLegalEntityFromSnapshot() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        when(platformApiClient.getLegalEntity("LE_SNAPSHOT")).thenReturn(PlatformApiResponse.of(
                Map.of("individual", Map.of("identificationData", Map.of("number", "123-45-6789")))));
        when(platformApiClient.createSweep("BA1", "TI1")).thenReturn(PlatformApiResponse.of(Map.of("id", "SWPC1")));
        AccountHolderSnapshot snapshot = new AccountHolderSnapshot(ACCOUNT_HOLDER_ID, "LE_SNAPSHOT",
                EnumSet.allOf(Capability.class), "TI1");

        stateMachine.process(Variant.COMPLETION, UPDATED, snapshot);

        assertThat(record.getTaxIdentifier()).isEqualTo("123-45-6789");
        verify(platformApiClient, never()).getLegalEntity("LE1");
    }

    @Test
    void process_completionVariantWithoutTaxIdentifierNeitherSweepsNorOnboards() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        when(platformApiClient.getLegalEntity("LE1")).thenThrow(PlatformApiException.serviceUnavailable());

        VerificationResult result = stateMachine.process(Variant.COMPLETION, UPDATED, allValid("TI1"));

        assertThat(result.isAllVerified()).isTrue();
        assertThat(result.isOnboarded()).isFalse();
        assertThat(record.getStatus()).isNotEqualTo(OnboardingStatus.ONBOARDED);
        verify(platformApiClient, never()).createSweep(anyString(), anyString());
    }

    @Test
    void process_completionVariantUsesSubmittedTaxIdentifier() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        record.setPmbData(Map.of("tin", "98-7654321"));
        givenRecord(record);
        stubUpdateAppliesTo(record);
        when(platformApiClient.createSweep("BA1", "TI1")).thenReturn(PlatformApiResponse.of(Map.of("id", "SWPC1")));

        VerificationResult result = stateMachine.process(Variant.COMPLETION, UPDATED, allValid("TI1"));

        assertThat(result.isOnboarded()).isTrue();
        verify(platformApiClient, never()).getLegalEntity(anyString());
    }

    @Test
    void process_completionCreatedEventSkippedUntilOnboardingDataKnown() {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);

        VerificationResult result = stateMachine.process(Variant.COMPLETION, CREATED, allValid("TI1"));

        assertThat(result.getOutcome()).isEqualTo(Outcome.SKIPPED);
        verifyNoInteractions(platformApiClient);
        verify(recordStore, never()).update(anyString(), any());
    }

    @Test
    void process_alreadyOnboardedOnlyRefreshesFlags() {
        CreationProgress progress = progressWithBalanceAccount();
        progress.setTransferInstrumentId("TI1");
        MerchantOnboardingRecord record = record(progress, new VerificationStatuses());
        record.setStatus(OnboardingStatus.ONBOARDED);
        givenRecord(record);
        stubUpdateAppliesTo(record);
        AccountHolderSnapshot snapshot = new AccountHolderSnapshot(ACCOUNT_HOLDER_ID, null,
                EnumSet.of(Capability.RECEIVE_PAYMENTS), null);

        VerificationResult result = stateMachine.process(Variant.WEBHOOK, UPDATED, snapshot);

        assertThat(result.isOnboarded()).isFalse();
        assertThat(record.getVerificationStatuses().isVerified(Capability.RECEIVE_PAYMENTS)).isTrue();
        assertThat(record.getCreationProgress().getSweepId()).isNull();
        verifyNoInteractions(platformApiClient);
    }

    @Test
    void process_completionVariantSkipsTaxLookupOnceOnboarded() {
        CreationProgress progress = progressWithBalanceAccount();
        progress.setTransferInstrumentId("TI1");
        progress.setSweepId("SWPC1");
        MerchantOnboardingRecord record = record(progress, new VerificationStatuses());
        record.setStatus(OnboardingStatus.ONBOARDED);
        givenRecord(record);
        stubUpdateAppliesTo(record);
        AccountHolderSnapshot snapshot = new AccountHolderSnapshot(ACCOUNT_HOLDER_ID, "LE1",
                EnumSet.of(Capability.SEND_TO_BALANCE_ACCOUNT), null);

        VerificationResult result = stateMachine.process(Variant.COMPLETION, UPDATED, snapshot);

        assertThat(result.isOnboarded()).isFalse();
        assertThat(record.getVerificationStatuses().isVerified(Capability.SEND_TO_BALANCE_ACCOUNT)).isTrue();
        assertThat(record.getTaxIdentifier()).isNull();
        verifyNoInteractions(platformApiClient);
    }

    @Test
    void process_versionConflictReappliesWithoutSecondSweep() {
        MerchantOnboardingRecord stale = record(progressWithBalanceAccount(), new VerificationStatuses());
        MerchantOnboardingRecord fresh = record(progressWithBalanceAccount(), new VerificationStatuses());
        fresh.getCreationProgress().setSweepId("SWPC_OTHER");
        givenRecord(stale);
        when(platformApiClient.createSweep("BA1", "TI1")).thenReturn(PlatformApiResponse.of(Map.of("id", "SWPC1")));
        when(recordStore.update(eq(MERCHANT_ID), any())).thenAnswer(invocation -> {
            Function<MerchantOnboardingRecord, Object> mutator = invocation.getArgument(1);
            mutator.apply(stale);
            return mutator.apply(fresh);
        });

        stateMachine.process(Variant.WEBHOOK, UPDATED, allValid("TI1"));

        verify(platformApiClient, times(1)).createSweep(anyString(), anyString());
        assertThat(fresh.getCreationProgress().getSweepId()).isEqualTo("SWPC_OTHER");
        assertThat(fresh.getStatus()).isEqualTo(OnboardingStatus.ONBOARDED);
    }

    @Test
    void applyWebhook_ignoresOtherEventTypes() throws Exception {
        VerificationResult result = stateMachine.applyWebhook(objectMapper.readTree(
                "{\"type\":\"balancePlatform.balanceAccount.updated\",\"data\":{}}"));

        assertThat(result.getOutcome()).isEqualTo(Outcome.IGNORED);
        verifyNoInteractions(recordStore, platformApiClient);
    }

    @Test
    void applyWebhook_readsCapabilitiesFromPayload() throws Exception {
        MerchantOnboardingRecord record = record(progressWithBalanceAccount(), new VerificationStatuses());
        givenRecord(record);
        stubUpdateAppliesTo(record);
        String body = "{\"type\":\"balancePlatform.accountHolder.updated\",\"data\":{\"accountHolder\":{"
                + "\"id\":\"" + ACCOUNT_HOLDER_ID + "\",\"capabilities\":{"
                + "\"receivePayments\":{\"verificationStatus\":\"valid\"},"
                + "\"sendToTransferInstrument\":{\"verificationStatus\":\"pending\","
                + "\"transferInstruments\":[{\"id\":\"SE_TI_9\"}]}}}}}";

        VerificationResult result = stateMachine.applyWebhook(objectMapper.readTree(body));

        assertThat(result.getOutcome()).isEqualTo(Outcome.PROCESSED);
        assertThat(record.getVerificationStatuses().isVerified(Capability.RECEIVE_PAYMENTS)).isTrue();
        assertThat(record.getVerificationStatuses().isVerified(Capability.SEND_TO_TRANSFER_INSTRUMENT)).isFalse();
        assertThat(record.getCreationProgress().getTransferInstrumentId()).isEqualTo("SE_TI_9");
    }

    @Test
    void applyWebhook_reportsFailureInsteadOfThrowing() throws Exception {
        when(recordStore.findByAccountHolderId(ACCOUNT_HOLDER_ID)).thenThrow(new IllegalStateException("db down"));
        String body = "{\"type\":\"balancePlatform.accountHolder.updated\",\"data\":{\"accountHolder\":{"
                + "\"id\":\"" + ACCOUNT_HOLDER_ID + "\"}}}";

        VerificationResult result = stateMachine.applyWebhook(objectMapper.readTree(body));

        assertThat(result.getOutcome()).isEqualTo(Outcome.FAILED);
        assertThat(result.getMessage()).contains("db down");
    }

    // ────────────────────────────────────────────────────────────

    private void givenRecord(MerchantOnboardingRecord record) {
        when(recordStore.findByAccountHolderId(ACCOUNT_HOLDER_ID)).thenReturn(Optional.of(record));
    }

    private void stubUpdateAppliesTo(MerchantOnboardingRecord record) {
        when(recordStore.update(eq(MERCHANT_ID), any())).thenAnswer(invocation -> {
            Function<MerchantOnboardingRecord, Object> mutator = invocation.getArgument(1);
            return mutator.apply(record);
        });
    }

    private static AccountHolderSnapshot allValid(String transferInstrumentId) {
        return new AccountHolderSnapshot(ACCOUNT_HOLDER_ID, null, EnumSet.allOf(Capability.class), transferInstrumentId);
    }

    private static CreationProgress progressWithBalanceAccount() {
        return CreationProgress.builder()
                .legalEntityId("LE1")
                .accountHolderId(ACCOUNT_HOLDER_ID)
                .balanceAccountId("BA1")
                .build();
    }

    private static MerchantOnboardingRecord record(CreationProgress progress, VerificationStatuses flags) {
        return MerchantOnboardingRecord.builder()
                .merchantId(MERCHANT_ID)
                .status(OnboardingStatus.READY_FOR_PLATFORM)
                .accountHolderId(ACCOUNT_HOLDER_ID)
                .creationProgress(progress)
                .verificationStatuses(flags)
                .build();
    }
}
