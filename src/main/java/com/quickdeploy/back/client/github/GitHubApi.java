package com.quickdeploy.back.client.github;

import java.util.Optional;

/**
 * The GitHub REST calls the deploy flow depends on.
 * Every method either returns its result or throws
 * {@link com.quickdeploy.back.common.error.ExternalApiException}; nothing is retried.
 */
public interface GitHubApi {

    /**
     * @return the authenticated user, or empty when the token was rejected (401/403)
     */
    Optional<GitHubUser> fetchUser(String token);

    /**
     * @param token may be null for an anonymous lookup
     * @return empty when the repository does not exist
     */
    Optional<GitHubRepository> fetchRepository(String token, String nwo);

    /**
     * Creates {@code name} under the authenticated user from the template {@code templateNwo}.
     */
    GitHubRepository generateFromTemplate(String token, String templateNwo, String name);

    GitHubRepository forkRepository(String token, String nwo, String name);

    /**
     * @return empty when the file does not exist
     */
    Optional<GitHubFile> getFile(String token, String nwo, String path);

    /**
     * Replaces the file, conditioned on {@code sha} being its current blob sha.
     */
    void updateFile(String token, String nwo, String path, String content, String sha, String message);

    void enableWorkflow(String token, String nwo, String workflow);

    RepositoryPublicKey getRepositoryPublicKey(String token, String nwo);

    /**
     * Creates or updates an Actions secret with a value sealed for the repository's public key.
     */
    void putSecret(String token, String nwo, String name, String keyId, String encryptedValue);
}
