package com.aigreentick.services.merchantonboarding.repository;

import com.aigreentick.services.merchantonboarding.entity.RawWebhookPayload;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RawWebhookPayloadRepository extends JpaRepository<RawWebhookPayload, Long> {

    Optional<RawWebhookPayload> findByBlobKey(String blobKey);
}
