package com.aigreentick.services.merchantonboarding.service;

import com.aigreentick.services.merchantonboarding.config.PlatformApiConfig;
import com.aigreentick.services.merchantonboarding.exception.SecretResolutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * SecretStore backed by the {@code platform.secrets} map, which is itself populated
 * from environment variables. Values are trimmed; blank values count as missing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfigurationSecretStore implements SecretStore {

    private final PlatformApiConfig platformApiConfig;

    @Override
    public String resolve(String name) {
        String value = platformApiConfig.getSecrets().get(name);
        if (value == null || value.isBlank()) {
            log.error("Secret '{}' is not configured", name);
            throw SecretResolutionException.missing(name);
        }
        return value.trim();
    }
}
