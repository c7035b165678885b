package com.aigreentick.services.merchantonboarding.client;

import com.aigreentick.services.merchantonboarding.config.PlatformApiConfig;
import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.dto.response.PlatformApiResponse;
import com.aigreentick.services.merchantonboarding.exception.MerchantOnboardingException;
import com.aigreentick.services.merchantonboarding.exception.PlatformApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the payment platform's Legal Entity Management, Balance Platform
 * and Management APIs.
 *
 * Resilience strategy (outermost → innermost):
 *   RateLimiter → CircuitBreaker → actual HTTP call
 *
 *   1. RateLimiter    : caps outbound calls per instance (configured in YAML)
 *   2. CircuitBreaker : opens after 50% failure rate; stays open 30s.
 *                       4xx (ClientException) does not count as a failure.
 *
 * No Retry: a failed call fails the whole invocation and the
 * retry unit is the outer trigger (a resubmitted onboarding request or a redelivered
 * webhook), which replays only the steps not yet recorded.
 *
 * Fallback: typed platform errors pass through unchanged; an open circuit or an
 * exhausted rate limit becomes PlatformApiException.serviceUnavailable().
 */
@Component
@Slf4j
public class PlatformApiClient {

    private static final String CB_NAME = "platformApi";

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient legalEntityClient;
    private final WebClient balancePlatformClient;
    private final WebClient managementClient;
    private final PlatformApiConfig platformApiConfig;
    private final ObjectMapper objectMapper;

    public PlatformApiClient(
            @Qualifier("legalEntityWebClient") WebClient legalEntityClient,
            @Qualifier("balancePlatformWebClient") WebClient balancePlatformClient,
            @Qualifier("managementWebClient") WebClient managementClient,
            PlatformApiConfig platformApiConfig,
            ObjectMapper objectMapper) {
        this.legalEntityClient = legalEntityClient;
        this.balancePlatformClient = balancePlatformClient;
        this.managementClient = managementClient;
        this.platformApiConfig = platformApiConfig;
        this.objectMapper = objectMapper;
    }

    // ======================================================
    // LEGAL ENTITY MANAGEMENT
    // ======================================================

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createLegalEntity(Map<String, Object> legalEntity) {
        log.info("Creating legal entity: type={}", legalEntity.get("type"));
        PlatformApiResponse response = exchange(legalEntityClient, HttpMethod.POST,
                "/legalEntities", legalEntity, "create legal entity");
        log.info("Legal entity created: id={}", response.getId());
        return response;
    }

    /**
     * Create the business-typed companion entity for an individual.
     * Reference is the individual's reference with "_sp" appended; name and registered
     * address are taken from the individual's name and residential address.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createSoleProprietorshipLegalEntity(Map<String, Object> individualLegalEntity) {
        Map<String, Object> individual = asMap(individualLegalEntity.get("individual"));
        Map<String, Object> name = asMap(individual.get("name"));
        Map<String, Object> address = asMap(individual.get("residentialAddress"));
        String country = stringOr(address.get("country"), platformApiConfig.getDefaultCountry());

        Map<String, Object> registeredAddress = new LinkedHashMap<>();
        registeredAddress.put("city", address.get("city"));
        registeredAddress.put("country", country);
        registeredAddress.put("postalCode", stringOr(address.get("postalCode"), ""));
        registeredAddress.put("stateOrProvince", stringOr(address.get("stateOrProvince"), ""));
        registeredAddress.put("street", stringOr(address.get("street"), ""));

        Map<String, Object> soleProprietorship = new LinkedHashMap<>();
        soleProprietorship.put("countryOfGoverningLaw", country);
        soleProprietorship.put("name",
                (stringOr(name.get("firstName"), "") + " " + stringOr(name.get("lastName"), "")).trim());
        soleProprietorship.put("registeredAddress", registeredAddress);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", OnboardingConstants.LEGAL_ENTITY_TYPE_SOLE_PROPRIETORSHIP);
        payload.put("reference", individualLegalEntity.get("reference") + "_sp");
        payload.put("soleProprietorship", soleProprietorship);

        log.info("Creating sole proprietorship legal entity: reference={}", payload.get("reference"));
        PlatformApiResponse response = exchange(legalEntityClient, HttpMethod.POST,
                "/legalEntities", payload, "create sole proprietorship legal entity");
        log.info("Sole proprietorship legal entity created: id={}", response.getId());
        return response;
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse mapIndividualToSoleProprietorship(String individualLegalEntityId,
                                                                 String soleProprietorshipLegalEntityId) {
        log.info("Associating individual {} with sole proprietorship {}",
                individualLegalEntityId, soleProprietorshipLegalEntityId);
        Map<String, Object> association = new LinkedHashMap<>();
        association.put("type", OnboardingConstants.LEGAL_ENTITY_TYPE_SOLE_PROPRIETORSHIP);
        association.put("legalEntityId", soleProprietorshipLegalEntityId);

        return exchange(legalEntityClient, HttpMethod.PATCH,
                "/legalEntities/" + individualLegalEntityId,
                Map.of("entityAssociations", List.of(association)),
                "map individual to sole proprietorship");
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse getLegalEntity(String legalEntityId) {
        log.debug("Fetching legal entity: id={}", legalEntityId);
        return exchange(legalEntityClient, HttpMethod.GET,
                "/legalEntities/" + legalEntityId, null, "get legal entity");
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createBusinessLine(String legalEntityId) {
        PlatformApiConfig.BusinessLine template = platformApiConfig.getBusinessLine();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service", template.getService());
        payload.put("industryCode", template.getIndustryCode());
        payload.put("salesChannels", template.getSalesChannels());
        if (template.getWebAddress() != null && !template.getWebAddress().isBlank()) {
            payload.put("webData", List.of(Map.of("webAddress", template.getWebAddress())));
        }
        payload.put("legalEntityId", legalEntityId);

        log.info("Creating business line for legal entity {}", legalEntityId);
        PlatformApiResponse response = exchange(legalEntityClient, HttpMethod.POST,
                "/businessLines", payload, "create business line");
        log.info("Business line created: id={}", response.getId());
        return response;
    }

    /**
     * Create the hosted onboarding link. Redirect target is the configured redirect
     * URL with "/confirmation" appended.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createOnboardingLink(String legalEntityId) {
        PlatformApiConfig.HostedOnboarding hosted = platformApiConfig.getHostedOnboarding();
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("changeLegalEntityType", hosted.isChangeLegalEntityType());
        settings.put("editPrefilledCountry", hosted.isEditPrefilledCountry());
        settings.put("enforceLegalAge", hosted.isEnforceLegalAge());

        Map<String, Object> payload = new LinkedHashMap<>();
        if (hosted.getThemeId() != null && !hosted.getThemeId().isBlank()) {
            payload.put("themeId", hosted.getThemeId());
        }
        payload.put("redirectUrl", stringOr(hosted.getRedirectUrl(), "") + "/confirmation");
        payload.put("locale", hosted.getLocale());
        payload.put("settings", settings);

        log.info("Creating hosted onboarding link for legal entity {}", legalEntityId);
        return exchange(legalEntityClient, HttpMethod.POST,
                "/legalEntities/" + legalEntityId + "/onboardingLinks", payload, "create onboarding link");
    }

    // ======================================================
    // BALANCE PLATFORM
    // ======================================================

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createAccountHolder(String legalEntityId, String description) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("description", description);
        payload.put("legalEntityId", legalEntityId);

        log.info("Creating account holder for legal entity {}", legalEntityId);
        PlatformApiResponse response = exchange(balancePlatformClient, HttpMethod.POST,
                "/accountHolders", payload, "create account holder");
        log.info("Account holder created: id={}", response.getId());
        return response;
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createBalanceAccount(String accountHolderId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("defaultCurrencyCode", platformApiConfig.getDefaultCurrency());
        payload.put("accountHolderId", accountHolderId);

        log.info("Creating balance account for account holder {}", accountHolderId);
        PlatformApiResponse response = exchange(balancePlatformClient, HttpMethod.POST,
                "/balanceAccounts", payload, "create balance account");
        log.info("Balance account created: id={}", response.getId());
        return response;
    }

    /**
     * Daily push sweep of the whole balance to the transfer instrument.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createSweep(String balanceAccountId, String transferInstrumentId) {
        String currency = platformApiConfig.getDefaultCurrency();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("counterparty", Map.of("transferInstrumentId", transferInstrumentId));
        payload.put("triggerAmount", Map.of("currency", currency, "value", 0));
        payload.put("currency", currency);
        payload.put("priorities", List.of("regular", "fast"));
        payload.put("category", "bank");
        payload.put("schedule", Map.of("type", "daily"));
        payload.put("type", "push");
        payload.put("status", "active");

        log.info("Creating sweep: balanceAccount={}, transferInstrument={}", balanceAccountId, transferInstrumentId);
        PlatformApiResponse response = exchange(balancePlatformClient, HttpMethod.POST,
                "/balanceAccounts/" + balanceAccountId + "/sweeps", payload, "create sweep configuration");
        log.info("Sweep created: id={}", response.getId());
        return response;
    }

    // ======================================================
    // MANAGEMENT
    // ======================================================

    /**
     * Split configuration with the fixed platform commission template.
     * The identifier comes back as {@code splitConfigurationId}, not {@code id}.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createSplitConfiguration() {
        Map<String, Object> commission = Map.of("variablePercentage", 349);

        Map<String, Object> splitLogic = new LinkedHashMap<>();
        splitLogic.put("paymentFee", "deductFromLiableAccount");
        splitLogic.put("chargeback", "deductFromLiableAccount");
        splitLogic.put("chargebackCostAllocation", "deductFromLiableAccount");
        splitLogic.put("commission", commission);
        splitLogic.put("refund", "deductAccordingToSplitRatio");
        splitLogic.put("refundCostAllocation", "deductFromOneBalanceAccount");

        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put("paymentMethod", "ANY");
        rule.put("shopperInteraction", "ANY");
        rule.put("fundingSource", "ANY");
        rule.put("currency", "ANY");
        rule.put("splitLogic", splitLogic);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("description", "Three percent variable");
        payload.put("rules", List.of(rule));

        String merchantAccount = platformApiConfig.getMerchantAccount();
        log.info("Creating split configuration for merchant account {}", merchantAccount);
        PlatformApiResponse response = exchange(managementClient, HttpMethod.POST,
                "/merchants/" + merchantAccount + "/splitConfigurations", payload, "create split configuration");
        log.info("Split configuration created: id={}", response.getSplitConfigurationId());
        return response;
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createStore(Map<String, Object> store,
                                           String businessLineId,
                                           String balanceAccountId,
                                           String splitConfigurationId) {
        Map<String, Object> payload = new LinkedHashMap<>(store);
        payload.put("merchantId", platformApiConfig.getMerchantAccount());
        payload.put("businessLineIds", List.of(businessLineId));
        payload.put("splitConfiguration", Map.of(
                "balanceAccountId", balanceAccountId,
                "splitConfigurationId", splitConfigurationId));

        log.info("Creating store: reference={}", store.get("reference"));
        PlatformApiResponse response = exchange(managementClient, HttpMethod.POST,
                "/stores", payload, "create store");
        log.info("Store created: id={}", response.getId());
        return response;
    }

    /**
     * @param paymentType {@code visa} or {@code mc}
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackPlatformResponse")
    @RateLimiter(name = CB_NAME)
    public PlatformApiResponse createPaymentMethod(String businessLineId, String paymentType) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", paymentType);
        payload.put("currencies", List.of(platformApiConfig.getDefaultCurrency()));
        payload.put("countries", List.of(platformApiConfig.getDefaultCountry()));
        payload.put("businessLineId", businessLineId);

        String merchantAccount = platformApiConfig.getMerchantAccount();
        log.info("Creating {} payment method for business line {}", paymentType, businessLineId);
        PlatformApiResponse response = exchange(managementClient, HttpMethod.POST,
                "/merchants/" + merchantAccount + "/paymentMethodSettings", payload,
                "create payment method settings");
        log.info("Payment method {} created: id={}", paymentType, response.getId());
        return response;
    }

    // ======================================================
    // TRANSPORT
    // ======================================================

    private PlatformApiResponse exchange(WebClient client, HttpMethod method, String path,
                                         Object body, String operation) {
        try {
            WebClient.RequestBodySpec request = client.method(method).uri(path);
            WebClient.ResponseSpec spec = body != null
                    ? request.bodyValue(body).retrieve()
                    : request.retrieve();

            Map<String, Object> response = spec
                    .onStatus(HttpStatusCode::isError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(raw -> PlatformApiException.failed(
                                            operation, res.statusCode().value(), extractDetail(raw))))
                    .bodyToMono(MAP_TYPE)
                    .block();

            return PlatformApiResponse.of(response);
        } catch (WebClientResponseException ex) {
            throw mapWebClientException(operation, ex);
        } catch (WebClientRequestException ex) {
            log.error("Platform {} request failed: {}", operation, ex.getMessage());
            throw new PlatformApiException("Failed to " + operation + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Pulls the platform's {@code detail} field out of an error body.
     * Non-JSON bodies (HTML error pages from a proxy) yield null.
     */
    private String extractDetail(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) return null;
        try {
            JsonNode node = objectMapper.readTree(rawBody);
            JsonNode detail = node.get("detail");
            return detail != null && !detail.isNull() ? detail.asText() : null;
        } catch (Exception e) {
            log.debug("Platform error body is not JSON: {}", rawBody.length() > 100
                    ? rawBody.substring(0, 100) + "..." : rawBody);
            return null;
        }
    }

    private RuntimeException mapWebClientException(String operation, WebClientResponseException ex) {
        return PlatformApiException.failed(operation, ex.getStatusCode().value(),
                extractDetail(ex.getResponseBodyAsString()));
    }

    // ======================================================
    // FALLBACKS
    // ======================================================

    /**
     * Fallback overloads, one per parameter shape of the @CircuitBreaker methods above.
     * Resilience4j resolves the overload whose leading parameters match the failed call.
     */
    private PlatformApiResponse fallbackPlatformResponse(Throwable ex) {
        return handleFallback(ex);
    }

    private PlatformApiResponse fallbackPlatformResponse(String param, Throwable ex) {
        return handleFallback(ex);
    }

    private PlatformApiResponse fallbackPlatformResponse(String param1, String param2, Throwable ex) {
        return handleFallback(ex);
    }

    private PlatformApiResponse fallbackPlatformResponse(Map<String, Object> payload, Throwable ex) {
        return handleFallback(ex);
    }

    private PlatformApiResponse fallbackPlatformResponse(Map<String, Object> payload, String p1, String p2,
                                                         String p3, Throwable ex) {
        return handleFallback(ex);
    }

    private PlatformApiResponse handleFallback(Throwable ex) {
        if (ex instanceof MerchantOnboardingException) {
            throw (MerchantOnboardingException) ex;
        }
        if (ex instanceof CallNotPermittedException) {
            log.error("Circuit OPEN: payment platform is unreachable. Calls blocked to protect the system.");
            throw PlatformApiException.serviceUnavailable();
        }
        if (ex instanceof RequestNotPermitted) {
            log.error("Platform rate limit exhausted for this instance");
            throw PlatformApiException.serviceUnavailable();
        }
        log.error("Platform API call failed: {}", ex.getMessage());
        throw new PlatformApiException("Payment platform call failed: " + ex.getMessage(), ex);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private static String stringOr(Object value, String fallback) {
        return value != null ? String.valueOf(value) : fallback;
    }
}
