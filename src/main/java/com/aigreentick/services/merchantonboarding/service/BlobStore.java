package com.aigreentick.services.merchantonboarding.service;

/**
 * Durable write-once storage for raw inbound payloads.
 * Implementations throw {@link com.aigreentick.services.merchantonboarding.exception.BlobStorageException}
 * when a payload cannot be stored.
 */
public interface BlobStore {

    void put(String key, String contentType, String content);

    String get(String key);
}
