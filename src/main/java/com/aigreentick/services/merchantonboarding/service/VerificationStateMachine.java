package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.client.PlatformApiClient;
import com.aigreentick.services.merchantonboarding.constants.Capability;
import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.dto.response.PlatformApiResponse;
import com.aigreentick.services.merchantonboarding.dto.response.VerificationResult;
import com.aigreentick.services.merchantonboarding.dto.response.VerificationResult.Outcome;
import com.aigreentick.services.merchantonboarding.dto.webhook.AccountHolderSnapshot;
import com.aigreentick.services.merchantonboarding.entity.CreationProgress;
import com.aigreentick.services.merchantonboarding.entity.MerchantOnboardingRecord;
import com.aigreentick.services.merchantonboarding.entity.VerificationStatuses;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

import static com.aigreentick.services.merchantonboarding.entity.CreationProgress.isPresent;

/**
 * Applies account holder capability updates to a merchant record and decides when the
 * payout sweep is created and when the merchant becomes ONBOARDED.
 *
 * Two entry points share the same rule:
 *   - WEBHOOK:    direct account holder webhook, updated events only
 *   - COMPLETION: ingested platform events, updated and created; additionally requires a
 *                 tax identifier (fetched from the legal entity when unknown) before the
 *                 sweep is attempted or the merchant is marked ONBOARDED
 *
 * Flow for one event:
 *   1. Find the merchant by account holder id
 *   2. Merge capability flags (never cleared) and the transfer instrument (set once)
 *   3. COMPLETION: resolve the tax identifier
 *   4. Already ONBOARDED → persist refreshed flags only, stop
 *   5. All six flags + transfer instrument + balance account + no sweep (+ tax id) → create sweep
 *   6. All six flags + sweep (+ tax id) → ONBOARDED
 *   7. One CAS write; the mutator re-evaluates against the fresh row on conflict
 *
 * Platform calls (legal entity lookup, sweep) happen before the write and are never
 * repeated by the CAS loop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VerificationStateMachine {

    public enum Variant {
        WEBHOOK,
        COMPLETION
    }

    private final MerchantRecordStore recordStore;
    private final PlatformApiClient platformApiClient;

    // ════════════════════════════════════════════════════════════
    // WEBHOOK ENTRY POINT
    // ════════════════════════════════════════════════════════════

    /**
     * Handles a {@code {type, data: {accountHolder}}} notification posted directly to the service.
     * Never throws: failures are reported in the result.
     */
    public VerificationResult applyWebhook(JsonNode body) {
        String type = body != null ? body.path("type").asText(null) : null;
        if (!OnboardingConstants.EVENT_ACCOUNT_HOLDER_UPDATED.equals(type)) {
            log.info("Unhandled account holder webhook type: {}", type);
            return VerificationResult.of(Outcome.IGNORED, null, "Webhook processed successfully");
        }

        JsonNode accountHolder = body.path("data").path("accountHolder");
        if (!accountHolder.isObject()) {
            log.info("Account holder webhook without data.accountHolder, ignoring");
            return VerificationResult.of(Outcome.IGNORED, null, "Webhook processed successfully");
        }

        AccountHolderSnapshot snapshot = AccountHolderSnapshot.from(accountHolder);
        try {
            return process(Variant.WEBHOOK, type, snapshot);
        } catch (RuntimeException e) {
            log.error("Error processing account holder webhook for {}: {}",
                    snapshot.accountHolderId(), e.getMessage(), e);
            return VerificationResult.of(Outcome.FAILED, snapshot.accountHolderId(),
                    "Webhook received but error occurred during processing: " + e.getMessage());
        }
    }

    // ════════════════════════════════════════════════════════════
    // SHARED TRANSITION RULE
    // ════════════════════════════════════════════════════════════

    public VerificationResult process(Variant variant, String eventCode, AccountHolderSnapshot snapshot) {
        String accountHolderId = snapshot.accountHolderId();
        Optional<MerchantOnboardingRecord> found = recordStore.findByAccountHolderId(accountHolderId);
        if (found.isEmpty()) {
            log.info("No merchant found for account holder {}", accountHolderId);
            return VerificationResult.of(Outcome.NO_MATCHING_MERCHANT, accountHolderId,
                    "User not found, webhook processed");
        }

        MerchantOnboardingRecord record = found.get();
        String merchantId = record.getMerchantId();
        CreationProgress progress = record.getCreationProgress();
        boolean taxGated = variant == Variant.COMPLETION;

        if (taxGated && OnboardingConstants.EVENT_ACCOUNT_HOLDER_CREATED.equals(eventCode)
                && !(progress.hasBalanceAccount() && progress.hasTransferInstrument()
                && isPresent(progress.getLegalEntityId()))) {
            log.info("Account holder created for merchant {} before onboarding data is complete, skipping", merchantId);
            return VerificationResult.of(Outcome.SKIPPED, accountHolderId,
                    "Balance account, transfer instrument or legal entity not yet known");
        }

        log.info("Processing {} {} for merchant {}, status={}", variant, eventCode, merchantId, record.getStatus());

        // Step 2: merge into a working copy
        VerificationStatuses flags = record.getVerificationStatuses().copy();
        boolean flagsChanged = false;
        for (Capability capability : snapshot.validCapabilities()) {
            if (flags.markVerified(capability)) {
                log.info("Merchant {}: {} verification is now valid", merchantId, capability.getKey());
                flagsChanged = true;
            }
        }
        String transferInstrumentId = isPresent(progress.getTransferInstrumentId())
                ? progress.getTransferInstrumentId()
                : snapshot.transferInstrumentId();
        boolean transferInstrumentFound = !progress.hasTransferInstrument() && isPresent(transferInstrumentId);

        // Step 3: an onboarded merchant no longer needs the tax identifier
        String taxIdentifier = record.knownTaxIdentifier();
        String fetchedTaxIdentifier = null;
        if (taxGated && taxIdentifier == null && !record.isOnboarded()) {
            String legalEntityId = isPresent(snapshot.legalEntityId())
                    ? snapshot.legalEntityId()
                    : progress.getLegalEntityId();
            fetchedTaxIdentifier = fetchTaxIdentifier(merchantId, legalEntityId);
            taxIdentifier = fetchedTaxIdentifier;
        }

        boolean refreshed = flagsChanged || transferInstrumentFound || fetchedTaxIdentifier != null;

        // Step 4
        if (record.isOnboarded()) {
            log.info("Merchant {} is already onboarded", merchantId);
            if (refreshed) {
                persist(variant, merchantId, snapshot, transferInstrumentId, fetchedTaxIdentifier, null);
            }
            return result(merchantId, accountHolderId, flags.allVerified(), false, false,
                    "Webhook processed successfully, user already onboarded");
        }

        // Step 5
        boolean allVerified = flags.allVerified();
        boolean taxSatisfied = !taxGated || taxIdentifier != null;
        boolean canAttemptSweep = allVerified
                && isPresent(transferInstrumentId)
                && progress.hasBalanceAccount()
                && !progress.hasSweep()
                && taxSatisfied;

        log.debug("Sweep conditions for merchant {}: allVerified={}, transferInstrument={}, balanceAccount={}, " +
                        "sweep={}, taxIdentifier={}",
                merchantId, allVerified, isPresent(transferInstrumentId), progress.hasBalanceAccount(),
                progress.hasSweep(), taxSatisfied);

        String sweepId = canAttemptSweep
                ? createSweep(merchantId, progress.getBalanceAccountId(), transferInstrumentId)
                : null;

        // Step 6
        boolean sweepSatisfied = sweepId != null || progress.hasSweep();
        boolean shouldOnboard = allVerified && sweepSatisfied && taxSatisfied;

        if (!refreshed && sweepId == null && !shouldOnboard) {
            log.info("Merchant {} not ready for onboarding: allVerified={}, sweep={}",
                    merchantId, allVerified, progress.getSweepId());
            return result(merchantId, accountHolderId, allVerified, false, false, "Webhook processed successfully");
        }

        // Step 7
        boolean onboarded = persist(variant, merchantId, snapshot, transferInstrumentId, fetchedTaxIdentifier, sweepId);
        return result(merchantId, accountHolderId, allVerified, sweepId != null, onboarded,
                "Webhook processed successfully");
    }

    // ════════════════════════════════════════════════════════════
    // PLATFORM CALLS (before the write, never inside it)
    // ════════════════════════════════════════════════════════════

    private String fetchTaxIdentifier(String merchantId, String legalEntityId) {
        if (!isPresent(legalEntityId)) {
            return null;
        }
        try {
            PlatformApiResponse legalEntity = platformApiClient.getLegalEntity(legalEntityId);
            String tin = TaxIdentifierExtractor.extract(legalEntity != null ? legalEntity.getFields() : null);
            if (tin == null) {
                log.warn("Could not find a tax identifier on legal entity {} for merchant {}", legalEntityId, merchantId);
            }
            return tin;
        } catch (RuntimeException e) {
            log.error("Error fetching tax identifier for merchant {}: {}", merchantId, e.getMessage());
            return null;
        }
    }

    private String createSweep(String merchantId, String balanceAccountId, String transferInstrumentId) {
        try {
            log.info("Creating sweep for merchant {}", merchantId);
            PlatformApiResponse response = platformApiClient.createSweep(balanceAccountId, transferInstrumentId);
            String sweepId = response != null ? response.getId() : null;
            if (!isPresent(sweepId)) {
                log.error("Sweep creation for merchant {} returned no id", merchantId);
                return null;
            }
            log.info("Sweep created for merchant {}: {}", merchantId, sweepId);
            return sweepId;
        } catch (RuntimeException e) {
            log.error("Failed to create sweep for merchant {}: {}", merchantId, e.getMessage());
            return null;
        }
    }

    // ════════════════════════════════════════════════════════════
    // WRITE
    // ════════════════════════════════════════════════════════════

    /**
     * Merges the event's outcome into the current row. Runs again on a fresh row after a
     * version conflict, so every change here is set-if-absent or monotonic.
     *
     * @return true if this write moved the merchant to ONBOARDED
     */
    private boolean persist(Variant variant,
                            String merchantId,
                            AccountHolderSnapshot snapshot,
                            String transferInstrumentId,
                            String fetchedTaxIdentifier,
                            String sweepId) {
        return recordStore.update(merchantId, current -> {
            VerificationStatuses flags = current.getVerificationStatuses();
            snapshot.validCapabilities().forEach(flags::markVerified);

            CreationProgress progress = current.getCreationProgress();
            if (!progress.hasTransferInstrument() && isPresent(transferInstrumentId)) {
                progress.setTransferInstrumentId(transferInstrumentId);
            }
            if (fetchedTaxIdentifier != null && current.getTaxIdentifier() == null) {
                current.setTaxIdentifier(fetchedTaxIdentifier);
            }
            if (sweepId != null) {
                if (progress.hasSweep()) {
                    log.warn("Merchant {} already has sweep {}; sweep {} is not recorded",
                            merchantId, progress.getSweepId(), sweepId);
                } else {
                    progress.setSweepId(sweepId);
                }
            }

            if (current.isOnboarded()) {
                return false;
            }
            boolean taxSatisfied = variant == Variant.WEBHOOK || current.hasTaxIdentifier();
            if (flags.allVerified() && progress.hasSweep() && taxSatisfied) {
                log.info("Marking merchant {} as ONBOARDED", merchantId);
                current.markOnboarded();
                return true;
            }
            return false;
        });
    }

    private static VerificationResult result(String merchantId, String accountHolderId, boolean allVerified,
                                             boolean sweepCreated, boolean onboarded, String message) {
        return VerificationResult.builder()
                .outcome(Outcome.PROCESSED)
                .merchantId(merchantId)
                .accountHolderId(accountHolderId)
                .allVerified(allVerified)
                .sweepCreated(sweepCreated)
                .onboarded(onboarded)
                .message(message)
                .build();
    }
}
