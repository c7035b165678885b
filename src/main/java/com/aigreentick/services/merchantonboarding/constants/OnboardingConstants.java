package com.aigreentick.services.merchantonboarding.constants;

/**
 * Application-wide constants for the merchant onboarding service
 */
public final class OnboardingConstants {

    private OnboardingConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // API Versioning
    public static final String API_V1 = "/api/v1";

    // Legal entity types
    public static final String LEGAL_ENTITY_TYPE_INDIVIDUAL = "individual";
    public static final String LEGAL_ENTITY_TYPE_SOLE_PROPRIETORSHIP = "soleProprietorship";
    public static final String DEFAULT_COUNTRY = "US";

    // Payment method types created for every store
    public static final String PAYMENT_METHOD_VISA = "visa";
    public static final String PAYMENT_METHOD_MASTERCARD = "mc";

    // Account holder event types consumed by the verification state machine
    public static final String EVENT_ACCOUNT_HOLDER_UPDATED = "balancePlatform.accountHolder.updated";
    public static final String EVENT_ACCOUNT_HOLDER_CREATED = "balancePlatform.accountHolder.created";
    public static final String BALANCE_PLATFORM_EVENT_PREFIX = "balancePlatform.";

    // Secret names resolved through the SecretStore
    public static final String SECRET_LEM_API_KEY = "lem-api-key";
    public static final String SECRET_BP_API_KEY = "bp-api-key";
    public static final String SECRET_PSP_API_KEY = "psp-api-key";
    public static final String SECRET_WEBHOOK_HMAC_KEY = "webhook-hmac-key";

    // Webhook blob storage
    public static final String WEBHOOK_BLOB_PREFIX = "platform-webhooks";

    // Outward notification
    public static final String EVENT_TYPE_ORGANIZATION_ONBOARDED = "ORGANIZATION_ONBOARDED";

    // Error Messages
    public static final String ERROR_MERCHANT_NOT_FOUND = "Onboarding data not found for merchant";
    public static final String ERROR_LINK_SAVE_FAILED =
            "Internal error: Link generated but failed to save data. Please contact support.";
    public static final String ERROR_LINK_STATUS_FAILED =
            "Internal error: Link generated but failed to update status. Please contact support.";
    public static final String ERROR_STORE_REFERENCE_EXISTS =
            "Store reference already exists on the payment platform. Please use a different store " +
                    "reference or contact support if this store belongs to you.";
    public static final String ERROR_WEBHOOK_VALIDATION_FAILED = "Webhook validation failed";

    // Success Messages
    public static final String SUCCESS_SUBMISSION_STORED = "Merchant onboarding data stored";
    public static final String SUCCESS_SUBMISSION_UPDATED = "Merchant onboarding data updated";
    public static final String SUCCESS_SUBMISSION_IGNORED = "Data submission processed successfully";
    public static final String SUCCESS_LINK_GENERATED = "Onboarding link generated";
    public static final String SUCCESS_WEBHOOK_ACCEPTED = "Accepted";
}
