package com.aigreentick.services.merchantonboarding.config;

import com.aigreentick.services.merchantonboarding.constants.OnboardingConstants;
import com.aigreentick.services.merchantonboarding.service.SecretStore;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for the payment platform's three APIs.
 *
 * One client per API, because each has its own base URL and its own API key:
 *   - legalEntityWebClient     → Legal Entity Management (lem-api-key)
 *   - balancePlatformWebClient → Balance Platform        (bp-api-key)
 *   - managementWebClient      → Management              (psp-api-key)
 *
 * Timeouts (all clients):
 * - Connect: platform.connect-timeout-millis (10s)
 * - Read / Write / Response: platform.timeout-seconds (30s)
 *
 * The X-API-Key header is resolved from the SecretStore on every request,
 * so a rotated key is picked up without a restart.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class WebClientConfig {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final PlatformApiConfig platformApiConfig;
    private final SecretStore secretStore;

    @Bean(name = "legalEntityWebClient")
    public WebClient legalEntityWebClient() {
        return buildClient(platformApiConfig.getLegalEntityApiUrl(), OnboardingConstants.SECRET_LEM_API_KEY);
    }

    @Bean(name = "balancePlatformWebClient")
    public WebClient balancePlatformWebClient() {
        return buildClient(platformApiConfig.getBalancePlatformApiUrl(), OnboardingConstants.SECRET_BP_API_KEY);
    }

    @Bean(name = "managementWebClient")
    public WebClient managementWebClient() {
        return buildClient(platformApiConfig.getManagementApiUrl(), OnboardingConstants.SECRET_PSP_API_KEY);
    }

    private WebClient buildClient(String baseUrl, String apiKeySecret) {
        int timeoutSeconds = platformApiConfig.getTimeoutSeconds();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, platformApiConfig.getConnectTimeoutMillis())
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                );

        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(apiKey(apiKeySecret))
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    private ExchangeFilterFunction apiKey(String secretName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest ->
                Mono.fromCallable(() -> ClientRequest.from(clientRequest)
                        .header(API_KEY_HEADER, secretStore.resolve(secretName))
                        .build()));
    }

    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("-> Platform API Request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            log.debug("<- Platform API Response: {}", clientResponse.statusCode());
            return Mono.just(clientResponse);
        });
    }
}
