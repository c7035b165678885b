package com.aigreentick.services.merchantonboarding.config;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Fail-fast validation for required payment platform configuration.
 * If any required value is missing or is still a placeholder, the application
 * context fails to load with a clear, actionable error message.
 *
 * Required env vars:
 *   - PLATFORM_LEM_API_URL        → platform.legal-entity-api-url
 *   - PLATFORM_BP_API_URL         → platform.balance-platform-api-url
 *   - PLATFORM_MANAGEMENT_API_URL → platform.management-api-url
 *   - PLATFORM_MERCHANT_ACCOUNT   → platform.merchant-account
 *
 * Secrets are checked as warnings only: a missing secret fails the handler that needs it.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class PlatformConfigValidator {

    private final PlatformApiConfig platformApiConfig;

    private static final Set<String> PLACEHOLDER_VALUES = Set.of(
            "",
            "null",
            "undefined",
            "${PLATFORM_LEM_API_URL}",
            "${PLATFORM_BP_API_URL}",
            "${PLATFORM_MANAGEMENT_API_URL}",
            "${PLATFORM_MERCHANT_ACCOUNT}"
    );

    private static final Set<String> SECRET_NAMES = Set.of(
            OnboardingConstants.SECRET_LEM_API_KEY,
            OnboardingConstants.SECRET_BP_API_KEY,
            OnboardingConstants.SECRET_PSP_API_KEY,
            OnboardingConstants.SECRET_WEBHOOK_HMAC_KEY
    );

    @PostConstruct
    public void validatePlatformConfig() {
        log.info("Validating payment platform configuration...");

        validateRequired("PLATFORM_LEM_API_URL", "platform.legal-entity-api-url",
                platformApiConfig.getLegalEntityApiUrl());
        validateRequired("PLATFORM_BP_API_URL", "platform.balance-platform-api-url",
                platformApiConfig.getBalancePlatformApiUrl());
        validateRequired("PLATFORM_MANAGEMENT_API_URL", "platform.management-api-url",
                platformApiConfig.getManagementApiUrl());
        validateRequired("PLATFORM_MERCHANT_ACCOUNT", "platform.merchant-account",
                platformApiConfig.getMerchantAccount());

        for (String secret : SECRET_NAMES) {
            if (isNullOrPlaceholder(platformApiConfig.getSecrets().get(secret))) {
                log.warn("Secret 'platform.secrets.{}' is not set. Calls that need it will fail.", secret);
            }
        }

        if (isNullOrPlaceholder(platformApiConfig.getHostedOnboarding().getRedirectUrl())) {
            log.warn("platform.hosted-onboarding.redirect-url is not set. " +
                    "Hosted onboarding will redirect to a relative '/confirmation' path.");
        }

        log.info("Payment platform configuration validated. Merchant account: {}",
                platformApiConfig.getMerchantAccount());
    }

    private void validateRequired(String envVar, String configKey, String value) {
        if (isNullOrPlaceholder(value)) {
            String message = String.format(
                    "%n%n" +
                            "╔══════════════════════════════════════════════════════════════╗%n" +
                            "║  STARTUP FAILED: Missing Required Configuration              ║%n" +
                            "╠══════════════════════════════════════════════════════════════╣%n" +
                            "║  Config key : %-48s ║%n" +
                            "║  Env var    : %-48s ║%n" +
                            "║                                                              ║%n" +
                            "║  Set the environment variable before starting the service:   ║%n" +
                            "║  export %s=<your-value>%n" +
                            "╚══════════════════════════════════════════════════════════════╝%n",
                    configKey, envVar, envVar
            );
            throw new IllegalStateException(message);
        }
    }

    private boolean isNullOrPlaceholder(String value) {
        if (value == null) return true;
        return PLACEHOLDER_VALUES.contains(value.trim().toLowerCase())
                || PLACEHOLDER_VALUES.contains(value.trim());
    }
}
