package com.aigreentick.services.merchantonboarding.service;

/**
 * Resolves API credentials and signing keys by name.
 * Implementations throw {@link com.aigreentick.services.merchantonboarding.exception.SecretResolutionException}
 * when a name cannot be resolved.
 */
public interface SecretStore {

    String resolve(String name);
}
