package com.quickdeploy.back.auth.model;

import lombok.ToString;
import lombok.Value;

/**
 * Client registration and endpoints of one OAuth provider.
 */
@Value
public class OAuthProviderSettings {

    String authorizeUrl;
    String tokenUrl;
    String clientId;

    @ToString.Exclude
    String clientSecret;

    String scopes;

    public boolean isConfigured() {
        return notBlank(authorizeUrl) && notBlank(tokenUrl) && notBlank(clientId);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
