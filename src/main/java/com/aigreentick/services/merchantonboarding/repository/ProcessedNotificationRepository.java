package com.aigreentick.services.merchantonboarding.repository;

import com.aigreentick.services.merchantonboarding.entity.ProcessedNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ProcessedNotificationRepository extends JpaRepository<ProcessedNotification, Long> {

    boolean existsByDedupKey(String dedupKey);

    @Modifying
    @Query("DELETE FROM ProcessedNotification p WHERE p.dedupKey = :dedupKey")
    int deleteByDedupKey(@Param("dedupKey") String dedupKey);
}
