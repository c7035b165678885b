package com.aigreentick.services.merchantonboarding.repository;

import com.aigreentick.services.merchantonboarding.entity.MerchantOnboardingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface MerchantOnboardingRecordRepository extends JpaRepository<MerchantOnboardingRecord, Long> {

    Optional<MerchantOnboardingRecord> findByMerchantId(String merchantId);

    Optional<MerchantOnboardingRecord> findFirstByAccountHolderIdOrderByIdAsc(String accountHolderId);

    boolean existsByMerchantId(String merchantId);

    // ── Atomic CAS operations ─────────────────────────────────

    /**
     * Link gate: hasGeneratedLink false → true. Returns 1 if this call flipped it,
     * 0 if it was already set (or the merchant does not exist).
     * Bulk updates bypass @Version, so the version is bumped by hand.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE MerchantOnboardingRecord r " +
            "SET r.hasGeneratedLink = true, r.updatedAt = :now, r.version = r.version + 1 " +
            "WHERE r.merchantId = :merchantId AND r.hasGeneratedLink = false")
    int markLinkGenerated(@Param("merchantId") String merchantId,
                          @Param("now") LocalDateTime now);
}
