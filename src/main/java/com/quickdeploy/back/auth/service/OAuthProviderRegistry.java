package com.quickdeploy.back.auth.service;

import com.quickdeploy.back.auth.model.OAuthProvider;
import com.quickdeploy.back.auth.model.OAuthProviderSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * OAuth client registrations, one per provider, from application properties.
 */
@Component
public class OAuthProviderRegistry {

    private final Map<OAuthProvider, OAuthProviderSettings> settings = new EnumMap<>(OAuthProvider.class);

    public OAuthProviderRegistry(
            @Value("${quickdeploy.github.oauth-url:https://github.com/login/oauth}") String githubOAuthUrl,
            @Value("${quickdeploy.github.client-id:}") String githubClientId,
            @Value("${quickdeploy.github.client-secret:}") String githubClientSecret,
            @Value("${quickdeploy.github.scopes:repo workflow}") String githubScopes,
            @Value("${quickdeploy.fastly.oauth-authorize-url:}") String fastlyAuthorizeUrl,
            @Value("${quickdeploy.fastly.oauth-token-url:}") String fastlyTokenUrl,
            @Value("${quickdeploy.fastly.client-id:}") String fastlyClientId,
            @Value("${quickdeploy.fastly.client-secret:}") String fastlyClientSecret,
            @Value("${quickdeploy.fastly.scopes:global}") String fastlyScopes) {
        settings.put(OAuthProvider.GITHUB, new OAuthProviderSettings(
                githubOAuthUrl + "/authorize", githubOAuthUrl + "/access_token",
                githubClientId, githubClientSecret, githubScopes));
        settings.put(OAuthProvider.FASTLY, new OAuthProviderSettings(
                fastlyAuthorizeUrl, fastlyTokenUrl, fastlyClientId, fastlyClientSecret, fastlyScopes));
    }

    public OAuthProviderSettings get(OAuthProvider provider) {
        return settings.get(provider);
    }
}
