package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.entity.RawWebhookPayload;
import com.aigreentick.services.merchantonboarding.exception.BlobStorageException;
import com.aigreentick.services.merchantonboarding.repository.RawWebhookPayloadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link BlobStore} backed by the raw_webhook_payloads table.
 * Each put commits on its own, so a stored payload survives a later failure in the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaBlobStore implements BlobStore {

    private final RawWebhookPayloadRepository repository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void put(String key, String contentType, String content) {
        try {
            repository.saveAndFlush(RawWebhookPayload.builder()
                    .blobKey(key)
                    .contentType(contentType)
                    .payload(content)
                    .build());
            log.debug("Blob stored: key={}, bytes={}", key, content.length());
        } catch (DataAccessException e) {
            log.error("Failed to store blob {}: {}", key, e.getMessage());
            throw new BlobStorageException("Failed to store webhook payload " + key, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public String get(String key) {
        return repository.findByBlobKey(key)
                .map(RawWebhookPayload::getPayload)
                .orElse(null);
    }
}
