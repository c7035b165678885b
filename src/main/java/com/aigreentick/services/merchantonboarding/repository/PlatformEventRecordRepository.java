package com.aigreentick.services.merchantonboarding.repository;

import com.aigreentick.services.merchantonboarding.entity.PlatformEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlatformEventRecordRepository extends JpaRepository<PlatformEventRecord, Long> {

    boolean existsByPspReference(String pspReference);
}
