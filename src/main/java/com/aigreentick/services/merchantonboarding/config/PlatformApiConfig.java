package com.aigreentick.services.merchantonboarding.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed config properties for the payment platform APIs.
 *
 * Bound from application.yaml under prefix "platform":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  platform:                                                      │
 * │    legal-entity-api-url:      ${PLATFORM_LEM_API_URL}          │
 * │    balance-platform-api-url:  ${PLATFORM_BP_API_URL}           │
 * │    management-api-url:        ${PLATFORM_MANAGEMENT_API_URL}   │
 * │    merchant-account:          ${PLATFORM_MERCHANT_ACCOUNT}     │
 * │    secrets:                                                     │
 * │      lem-api-key:             ${PLATFORM_LEM_API_KEY}          │
 * │      webhook-hmac-key:        ${PLATFORM_WEBHOOK_HMAC_KEY}     │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * All sensitive values come from environment variables, never hardcoded.
 * See PlatformConfigValidator for fail-fast startup validation.
 */
@Configuration
@ConfigurationProperties(prefix = "platform")
@Data
public class PlatformApiConfig {

    /** Legal Entity Management API base URL, including its version path */
    private String legalEntityApiUrl;

    /** Balance Platform API base URL (account holders, balance accounts, sweeps) */
    private String balancePlatformApiUrl;

    /** Management API base URL (stores, split configurations, payment methods) */
    private String managementApiUrl;

    /** Platform merchant account that stores, splits and payment methods are created under */
    private String merchantAccount;

    private int connectTimeoutMillis = 10_000;

    /** Applies to read, write and whole-response timeouts of every platform call */
    private int timeoutSeconds = 30;

    /** Currency for balance accounts, payment methods and sweeps */
    private String defaultCurrency = "USD";

    private String defaultCountry = "US";

    private HostedOnboarding hostedOnboarding = new HostedOnboarding();

    private BusinessLine businessLine = new BusinessLine();

    /** Named secrets served by ConfigurationSecretStore (API keys, webhook HMAC key) */
    private Map<String, String> secrets = new HashMap<>();

    @Data
    public static class HostedOnboarding {

        /** Base redirect URL; "/confirmation" is appended */
        private String redirectUrl = "";

        private String locale = "en-US";

        private String themeId;

        private boolean changeLegalEntityType = false;

        private boolean editPrefilledCountry = false;

        private boolean enforceLegalAge = true;
    }

    @Data
    public static class BusinessLine {

        private String service = "paymentProcessing";

        private String industryCode = "339E";

        private List<String> salesChannels = new ArrayList<>(List.of("eCommerce", "ecomMoto"));

        private String webAddress;
    }
}
