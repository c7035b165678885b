package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.client.PlatformApiClient;
import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.constants.OnboardingStep;
import com.aigreentick.services.merchantonboarding.dto.response.OnboardingLinkResponse;
import com.aigreentick.services.merchantonboarding.dto.response.PlatformApiResponse;
import com.aigreentick.services.merchantonboarding.entity.CreationProgress;
import com.aigreentick.services.merchantonboarding.entity.MerchantOnboardingRecord;
import com.aigreentick.services.merchantonboarding.exception.LinkGeneratedNotRecordedException;
import com.aigreentick.services.merchantonboarding.exception.PlatformApiException;
import com.aigreentick.services.merchantonboarding.exception.StoreReferenceConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Function;
import java.util.function.Supplier;

import static com.aigreentick.services.merchantonboarding.entity.CreationProgress.isPresent;

/**
 * Drives the platform entity chain for one merchant and returns a hosted onboarding link.
 *
 * Steps run strictly in order, each on the calling thread, each skipped when its identifier
 * is already in the persisted creation progress:
 *
 *   1. legal entity
 *   2. sole proprietorship + association (individuals only)
 *   3. account holder          (under the legal entity)
 *   4. business line           (under the legal entity)
 *   5. split configuration     (platform merchant account)
 *   6. balance account         (under the account holder)
 *   7. store                   (business line + balance account + split configuration)
 *   8. Visa, then Mastercard payment method settings
 *   9. hosted onboarding link
 *  10. persist creation progress if it changed, then flip hasGeneratedLink
 *
 * Nothing is written until step 10. A failed step aborts the invocation and the caller
 * retries the whole request; steps whose identifiers were persisted by an earlier,
 * fully successful run are not repeated.
 *
 * No @Transactional here: platform calls must never run inside a DB transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OnboardingOrchestrator {

    private final PlatformApiClient platformApiClient;
    private final MerchantRecordStore recordStore;

    // ════════════════════════════════════════════════════════════
    // MAIN FLOW
    // ════════════════════════════════════════════════════════════

    public OnboardingLinkResponse generateOnboardingLink(String merchantId) {
        MerchantOnboardingRecord record = recordStore.getOrThrow(merchantId);
        MerchantProfile profile = MerchantProfile.of(record.getMerchantData());
        profile.validateForOnboarding();

        CreationProgress snapshot = record.getCreationProgress().copy();
        CreationProgress progress = snapshot.copy();
        boolean individual = profile.isIndividual();

        log.info("Onboarding saga started: merchantId={}, individual={}", merchantId, individual);

        // Step 1
        if (!isPresent(progress.getLegalEntityId())) {
            progress.setLegalEntityId(runStep(OnboardingStep.LEGAL_ENTITY, merchantId,
                    () -> platformApiClient.createLegalEntity(profile.legalEntity()),
                    PlatformApiResponse::getId));
        }

        // Step 2: the platform needs a business-typed entity next to an individual
        if (individual && !isPresent(progress.getSoleProprietorshipLegalEntityId())) {
            String legalEntityId = progress.getLegalEntityId();
            progress.setSoleProprietorshipLegalEntityId(runStep(OnboardingStep.SOLE_PROPRIETORSHIP, merchantId,
                    () -> {
                        PlatformApiResponse created =
                                platformApiClient.createSoleProprietorshipLegalEntity(profile.legalEntity());
                        if (isPresent(created.getId())) {
                            platformApiClient.mapIndividualToSoleProprietorship(legalEntityId, created.getId());
                        }
                        return created;
                    },
                    PlatformApiResponse::getId));
        }

        // Step 3
        if (!isPresent(progress.getAccountHolderId())) {
            String description = "Account holder for " + profile.providerGroupName();
            progress.setAccountHolderId(runStep(OnboardingStep.ACCOUNT_HOLDER, merchantId,
                    () -> platformApiClient.createAccountHolder(progress.getLegalEntityId(), description),
                    PlatformApiResponse::getId));
        }

        // Step 4
        if (!isPresent(progress.getBusinessLineId())) {
            progress.setBusinessLineId(runStep(OnboardingStep.BUSINESS_LINE, merchantId,
                    () -> platformApiClient.createBusinessLine(progress.getLegalEntityId()),
                    PlatformApiResponse::getId));
        }

        // Step 5
        if (!isPresent(progress.getSplitConfigurationId())) {
            progress.setSplitConfigurationId(runStep(OnboardingStep.SPLIT_CONFIGURATION, merchantId,
                    platformApiClient::createSplitConfiguration,
                    PlatformApiResponse::getSplitConfigurationId));
        }

        // Step 6
        if (!isPresent(progress.getBalanceAccountId())) {
            progress.setBalanceAccountId(runStep(OnboardingStep.BALANCE_ACCOUNT, merchantId,
                    () -> platformApiClient.createBalanceAccount(progress.getAccountHolderId()),
                    PlatformApiResponse::getId));
        }

        // Step 7
        if (!isPresent(progress.getStoreId())) {
            progress.setStoreId(createStore(merchantId, profile, progress));
        }

        // Step 8
        if (!isPresent(progress.getVisaPaymentMethodId())) {
            progress.setVisaPaymentMethodId(runStep(OnboardingStep.VISA_PAYMENT_METHOD, merchantId,
                    () -> platformApiClient.createPaymentMethod(
                            progress.getBusinessLineId(), OnboardingConstants.PAYMENT_METHOD_VISA),
                    PlatformApiResponse::getId));
        }
        if (!isPresent(progress.getMastercardPaymentMethodId())) {
            progress.setMastercardPaymentMethodId(runStep(OnboardingStep.MASTERCARD_PAYMENT_METHOD, merchantId,
                    () -> platformApiClient.createPaymentMethod(
                            progress.getBusinessLineId(), OnboardingConstants.PAYMENT_METHOD_MASTERCARD),
                    PlatformApiResponse::getId));
        }

        // Step 9: not recorded in progress, every run issues a fresh link
        String linkTarget = individual
                ? progress.getSoleProprietorshipLegalEntityId()
                : progress.getLegalEntityId();
        String url = runStep(OnboardingStep.ONBOARDING_LINK, merchantId,
                () -> platformApiClient.createOnboardingLink(linkTarget),
                PlatformApiResponse::getUrl);

        // Step 10: from here on the link exists, so failures need an operator
        recordProgress(merchantId, snapshot, progress);
        recordLinkGenerated(merchantId);

        log.info("Onboarding saga completed: merchantId={}", merchantId);
        return OnboardingLinkResponse.builder().url(url).build();
    }

    // ════════════════════════════════════════════════════════════
    // STEPS
    // ════════════════════════════════════════════════════════════

    private String createStore(String merchantId, MerchantProfile profile, CreationProgress progress) {
        try {
            return runStep(OnboardingStep.STORE, merchantId,
                    () -> platformApiClient.createStore(
                            profile.primaryStore(),
                            progress.getBusinessLineId(),
                            progress.getBalanceAccountId(),
                            progress.getSplitConfigurationId()),
                    PlatformApiResponse::getId);
        } catch (PlatformApiException ex) {
            if (ex.isReferenceConflict()) {
                log.error("Store reference already taken on the platform: merchantId={}, reference={}",
                        merchantId, profile.primaryStore().get("reference"));
                throw StoreReferenceConflictException.of(ex);
            }
            throw ex;
        }
    }

    /**
     * Runs one platform call and extracts the identifier it produced.
     * Any platform failure is re-labelled with the step's caller-facing message.
     */
    private String runStep(OnboardingStep step,
                           String merchantId,
                           Supplier<PlatformApiResponse> call,
                           Function<PlatformApiResponse, String> identifier) {
        log.debug("Step {} started: merchantId={}", step, merchantId);
        PlatformApiResponse response;
        try {
            response = call.get();
        } catch (PlatformApiException ex) {
            log.error("Step {} failed for merchant {}: {}", step, merchantId, ex.getMessage());
            throw PlatformApiException.stepFailed(step.getFailureMessage(), ex);
        }

        String id = response != null ? identifier.apply(response) : null;
        if (!isPresent(id)) {
            log.error("Step {} for merchant {} returned no identifier", step, merchantId);
            throw PlatformApiException.stepFailed(step.getFailureMessage(),
                    PlatformApiException.missingIdentifier(step.name().toLowerCase().replace('_', ' ')));
        }
        log.debug("Step {} completed: merchantId={}, id={}", step, merchantId, id);
        return id;
    }

    // ════════════════════════════════════════════════════════════
    // PERSISTENCE (only after the link exists)
    // ════════════════════════════════════════════════════════════

    private void recordProgress(String merchantId, CreationProgress snapshot, CreationProgress progress) {
        if (progress.equals(snapshot)) {
            log.debug("Creation progress unchanged for merchant {}, skipping write", merchantId);
            return;
        }
        try {
            recordStore.update(merchantId, record -> {
                record.getCreationProgress().fillSagaOutputsFrom(progress);
                record.setAccountHolderId(record.getCreationProgress().getAccountHolderId());
                return null;
            });
            log.info("Creation progress saved: merchantId={}, accountHolderId={}",
                    merchantId, progress.getAccountHolderId());
        } catch (RuntimeException ex) {
            log.error("ESCALATE: link generated for merchant {} but creation progress not saved. Progress: {}",
                    merchantId, progress, ex);
            throw LinkGeneratedNotRecordedException.progressNotSaved(ex);
        }
    }

    private void recordLinkGenerated(String merchantId) {
        try {
            if (!recordStore.markLinkGenerated(merchantId)) {
                log.info("Merchant {} already had hasGeneratedLink=true; link reissued", merchantId);
            }
        } catch (RuntimeException ex) {
            log.error("ESCALATE: link generated for merchant {} but hasGeneratedLink not set", merchantId, ex);
            throw LinkGeneratedNotRecordedException.flagNotSaved(ex);
        }
    }
}
