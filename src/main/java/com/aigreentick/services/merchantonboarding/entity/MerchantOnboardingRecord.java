package com.aigreentick.services.merchantonboarding.entity;

import com.aigreentick.services.merchantonboarding.constants.OnboardingStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One record per merchant, shared by the onboarding saga and the verification state machine.
 * Never deleted. Every write goes through {@link #version}, so two writers that loaded the
 * same snapshot cannot both commit.
 */
@Entity
@Table(
        name = "merchant_onboarding_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_merchant_onboarding_merchant", columnNames = "merchant_id")
        },
        indexes = {
                @Index(name = "idx_merchant_onboarding_account_holder", columnList = "account_holder_id"),
                @Index(name = "idx_merchant_onboarding_status", columnList = "status"),
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MerchantOnboardingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "merchant_id", nullable = false, length = 100)
    private String merchantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    @Builder.Default
    private OnboardingStatus status = OnboardingStatus.SUBMITTED;

    /** One-way gate: once true the submitted profile is frozen */
    @Column(name = "has_generated_link", nullable = false)
    @Builder.Default
    private boolean hasGeneratedLink = false;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "merchant_data", columnDefinition = "TEXT")
    private Map<String, Object> merchantData;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "pmb_data", columnDefinition = "TEXT")
    private Map<String, Object> pmbData;

    @Embedded
    @Builder.Default
    private CreationProgress creationProgress = new CreationProgress();

    @Embedded
    @Builder.Default
    private VerificationStatuses verificationStatuses = new VerificationStatuses();

    /** Copy of creationProgress.accountHolderId, indexed for webhook lookups */
    @Column(name = "account_holder_id", length = 100)
    private String accountHolderId;

    @Column(name = "tax_identifier", length = 100)
    private String taxIdentifier;

    @Column(name = "user_email", length = 320)
    private String userEmail;

    @Column(name = "submission_count", nullable = false)
    @Builder.Default
    private int submissionCount = 0;

    @Column(name = "agreement_timestamp", length = 50)
    private String agreementTimestamp;

    @Column(name = "baa_timestamp", length = 50)
    private String businessAssociateAgreementTimestamp;

    @Column(name = "onboarded_at")
    private LocalDateTime onboardedAt;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    // Hibernate loads an embeddable whose columns are all null as null

    public CreationProgress getCreationProgress() {
        if (creationProgress == null) {
            creationProgress = new CreationProgress();
        }
        return creationProgress;
    }

    public VerificationStatuses getVerificationStatuses() {
        if (verificationStatuses == null) {
            verificationStatuses = new VerificationStatuses();
        }
        return verificationStatuses;
    }

    public boolean isOnboarded() {
        return status == OnboardingStatus.ONBOARDED;
    }

    /**
     * The fetched tax identifier, else the one the merchant submitted as pmbData.tin.
     */
    public String knownTaxIdentifier() {
        if (taxIdentifier != null && !taxIdentifier.isBlank()) {
            return taxIdentifier;
        }
        Object submitted = pmbData != null ? pmbData.get("tin") : null;
        if (submitted == null || String.valueOf(submitted).isBlank()) {
            return null;
        }
        return String.valueOf(submitted);
    }

    public boolean hasTaxIdentifier() {
        return knownTaxIdentifier() != null;
    }

    public void markOnboarded() {
        this.status = OnboardingStatus.ONBOARDED;
        this.onboardedAt = LocalDateTime.now();
    }
}
