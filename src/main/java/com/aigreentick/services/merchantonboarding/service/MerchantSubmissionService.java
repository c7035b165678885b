package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.constants.OnboardingStatus;
import com.aigreentick.services.merchantonboarding.dto.request.MerchantSubmissionRequest;
import com.aigreentick.services.merchantonboarding.dto.response.MerchantSubmissionResponse;
import com.aigreentick.services.merchantonboarding.entity.MerchantOnboardingRecord;
import com.aigreentick.services.merchantonboarding.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores and serves the merchant's onboarding profile.
 *
 * The profile is write-once from the platform's point of view: after the hosted
 * onboarding link is issued, submissions carrying profile data are acknowledged
 * but not applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MerchantSubmissionService {

    private static final String TIN_FIELD = "tin";

    private final MerchantRecordStore recordStore;

    /**
     * Create or merge the merchant's submission.
     *
     * @return the caller-facing message (stored / updated / ignored)
     */
    public String submit(String merchantId, MerchantSubmissionRequest request) {
        if (request == null) {
            throw InvalidRequestException.missingBody();
        }

        Optional<MerchantOnboardingRecord> existing = recordStore.get(merchantId);
        if (existing.isEmpty()) {
            try {
                createRecord(merchantId, request);
                return OnboardingConstants.SUCCESS_SUBMISSION_STORED;
            } catch (DataIntegrityViolationException ex) {
                // Concurrent first submission won the insert; merge into it instead
                log.info("Record for merchant {} created concurrently, merging submission", merchantId);
            }
        }

        return recordStore.update(merchantId, record -> applySubmission(record, request));
    }

    public MerchantSubmissionResponse getSubmission(String merchantId) {
        MerchantOnboardingRecord record = recordStore.getOrThrow(merchantId);
        return MerchantSubmissionResponse.builder()
                .merchantData(record.getMerchantData())
                .pmbData(withoutTin(record.getPmbData()))
                .status(record.getStatus())
                .agreementTimestamp(record.getAgreementTimestamp())
                .businessAssociateAgreementTimestamp(record.getBusinessAssociateAgreementTimestamp())
                .hasGeneratedLink(record.isHasGeneratedLink())
                .build();
    }

    // ========================
    // PRIVATE HELPERS
    // ========================

    private void createRecord(String merchantId, MerchantSubmissionRequest request) {
        MerchantOnboardingRecord record = MerchantOnboardingRecord.builder()
                .merchantId(merchantId)
                .merchantData(request.getMerchantData())
                .pmbData(request.getPmbData())
                .userEmail(request.getUserEmail())
                .agreementTimestamp(request.getAgreementTimestamp())
                .businessAssociateAgreementTimestamp(request.getBusinessAssociateAgreementTimestamp())
                .submissionCount(1)
                .hasGeneratedLink(false)
                .status(deriveStatus(OnboardingStatus.SUBMITTED, request.getMerchantData()))
                .build();
        recordStore.create(record);
    }

    private String applySubmission(MerchantOnboardingRecord record, MerchantSubmissionRequest request) {
        if (record.isHasGeneratedLink() && request.carriesProfileData()) {
            log.info("Merchant {} attempted to modify profile after link generation. Ignoring changes.",
                    record.getMerchantId());
            return OnboardingConstants.SUCCESS_SUBMISSION_IGNORED;
        }

        if (request.getMerchantData() != null) {
            record.setMerchantData(ProfileMerger.deepMerge(record.getMerchantData(), request.getMerchantData()));
        }
        if (request.getPmbData() != null) {
            record.setPmbData(ProfileMerger.deepMerge(record.getPmbData(), request.getPmbData()));
        }
        if (request.getAgreementTimestamp() != null) {
            record.setAgreementTimestamp(request.getAgreementTimestamp());
        }
        if (request.getBusinessAssociateAgreementTimestamp() != null) {
            record.setBusinessAssociateAgreementTimestamp(request.getBusinessAssociateAgreementTimestamp());
        }
        record.setUserEmail(request.getUserEmail());
        record.setSubmissionCount(record.getSubmissionCount() + 1);
        record.setStatus(deriveStatus(record.getStatus(), record.getMerchantData()));

        log.info("Merchant {} submission #{} merged, status={}",
                record.getMerchantId(), record.getSubmissionCount(), record.getStatus());
        return OnboardingConstants.SUCCESS_SUBMISSION_UPDATED;
    }

    private OnboardingStatus deriveStatus(OnboardingStatus current, Map<String, Object> merchantData) {
        OnboardingStatus derived = MerchantProfile.of(merchantData).hasStoreReference()
                ? OnboardingStatus.READY_FOR_PLATFORM
                : OnboardingStatus.SUBMITTED;
        return current.advanceTo(derived);
    }

    private Map<String, Object> withoutTin(Map<String, Object> pmbData) {
        if (pmbData == null) return null;
        Map<String, Object> sanitized = new LinkedHashMap<>(pmbData);
        sanitized.remove(TIN_FIELD);
        return sanitized;
    }
}
