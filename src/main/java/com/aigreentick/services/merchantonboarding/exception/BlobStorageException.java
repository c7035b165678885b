package com.aigreentick.services.merchantonboarding.exception;

/**
 * Thrown when a raw webhook payload cannot be stored durably
 */
public class BlobStorageException extends MerchantOnboardingException {

    public BlobStorageException(String message, Throwable cause) {
        super(message, "BLOB_STORAGE_FAILED", cause);
    }
}
