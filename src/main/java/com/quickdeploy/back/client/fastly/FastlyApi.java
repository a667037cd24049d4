package com.quickdeploy.back.client.fastly;

import java.util.List;
import java.util.Optional;

/**
 * The Fastly API calls the deploy flow depends on.
 * Every method either returns its result or throws
 * {@link com.quickdeploy.back.common.error.ExternalApiException}; nothing is retried.
 */
public interface FastlyApi {

    /**
     * @return the token's user, or empty when the token was rejected (401/403)
     */
    Optional<FastlyUser> fetchUser(String token);

    /**
     * Creates a Compute (wasm) service. Version 1 is created with it.
     */
    FastlyService createService(String token, String name);

    FastlyDomain createDomain(String token, String serviceId, int version, String name);

    FastlyBackend createBackend(String token, String serviceId, int version, FastlyBackend backend);

    FastlyDictionary createDictionary(String token, String serviceId, int version, String name);

    void updateDictionaryItems(String token, String serviceId, String dictionaryId,
                               List<DictionaryItemOperation> items);

    FastlyServiceVersion getServiceVersion(String token, String serviceId, int version);
}
