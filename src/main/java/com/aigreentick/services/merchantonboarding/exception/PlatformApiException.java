package com.aigreentick.services.merchantonboarding.exception;

import lombok.Getter;

/**
 * Thrown when a payment platform API call fails or the platform is unavailable
 *
 * Has two types:
 * - PlatformApiException: server errors (5xx), timeouts, open circuit
 * - PlatformApiException.ClientException: client errors (4xx)
 *
 * Neither is retried in-process. The retry unit is the outer trigger
 * (a resubmitted onboarding request or a redelivered webhook).
 */
@Getter
public class PlatformApiException extends MerchantOnboardingException {

    private static final String ERROR_CODE = "PLATFORM_API_ERROR";
    private static final String REFERENCE_CONFLICT_MARKER = "already exist";

    private final int httpStatus;

    /** The platform's own error detail, when the response carried one */
    private final String detail;

    public PlatformApiException(String message) {
        super(message, ERROR_CODE);
        this.httpStatus = 503;
        this.detail = null;
    }

    public PlatformApiException(String message, int httpStatus, String detail) {
        super(message, ERROR_CODE);
        this.httpStatus = httpStatus;
        this.detail = detail;
    }

    public PlatformApiException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
        this.httpStatus = 503;
        this.detail = null;
    }

    public PlatformApiException(String message, int httpStatus, String detail, Throwable cause) {
        super(message, ERROR_CODE, cause);
        this.httpStatus = httpStatus;
        this.detail = detail;
    }

    public static PlatformApiException serviceUnavailable() {
        return new PlatformApiException(
                "Payment platform is temporarily unavailable. Please try again later."
        );
    }

    public static PlatformApiException failed(String operation, int httpStatus, String detail) {
        String reason = detail != null ? detail : "Request failed with status code " + httpStatus;
        if (httpStatus >= 400 && httpStatus < 500) {
            return new ClientException("Failed to " + operation + ": " + reason, httpStatus, detail);
        }
        return new PlatformApiException("Failed to " + operation + ": " + reason, httpStatus, detail);
    }

    /**
     * Re-labels a failed call with the caller-facing message of the saga step it belonged to.
     * Status and platform detail are carried over.
     */
    public static PlatformApiException stepFailed(String stepMessage, PlatformApiException cause) {
        return new PlatformApiException(stepMessage, cause.getHttpStatus(), cause.getDetail(), cause);
    }

    public static PlatformApiException missingIdentifier(String operation) {
        return new PlatformApiException("Failed to " + operation + ": platform response carried no identifier",
                502, null);
    }

    /**
     * True when the platform rejected the request because a unique reference is already taken.
     */
    public boolean isReferenceConflict() {
        String text = detail != null ? detail : getMessage();
        return text != null && text.contains(REFERENCE_CONFLICT_MARKER);
    }

    // ========================
    // INNER CLASS
    // 4xx errors
    // ========================

    /**
     * Represents a 4xx client error from the platform (bad request, invalid key, duplicate reference)
     */
    @Getter
    public static class ClientException extends PlatformApiException {

        public ClientException(String message, int httpStatus, String detail) {
            super(message, httpStatus, detail);
        }
    }
}
