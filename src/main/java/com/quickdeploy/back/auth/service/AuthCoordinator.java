package com.quickdeploy.back.auth.service;

import com.quickdeploy.back.auth.model.IdentityView;
import com.quickdeploy.back.auth.model.OAuthProvider;
import com.quickdeploy.back.auth.model.OAuthProviderSettings;
import com.quickdeploy.back.client.fastly.FastlyApi;
import com.quickdeploy.back.client.fastly.FastlyUser;
import com.quickdeploy.back.client.github.GitHubApi;
import com.quickdeploy.back.client.github.GitHubUser;
import com.quickdeploy.back.common.error.AuthException;
import com.quickdeploy.back.common.error.PreconditionException;
import com.quickdeploy.back.session.model.LoginState;
import com.quickdeploy.back.session.model.SessionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Owns sign-in with GitHub and Fastly. The only writer of {@link LoginState}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthCoordinator {

    private final OAuthProviderRegistry providers;
    private final OAuthTokenClient tokenClient;
    private final GitHubApi github;
    private final FastlyApi fastly;

    /**
     * Provider authorize URL carrying our client id and the requested scopes.
     */
    public String authorizeUrl(OAuthProvider provider) {
        OAuthProviderSettings settings = configured(provider);
        return UriComponentsBuilder.fromHttpUrl(settings.getAuthorizeUrl())
                .queryParam("client_id", settings.getClientId())
                .queryParam("scope", settings.getScopes())
                .build()
                .encode()
                .toUriString();
    }

    /**
     * Exchanges the callback code for a token and stores it in the session.
     */
    public void completeAuthorization(OAuthProvider provider, String code, SessionContext session) {
        if (code == null || code.isBlank()) {
            throw new AuthException("No authorization code provided");
        }
        String token = tokenClient.exchangeCode(configured(provider), code);
        storeToken(provider, token, session);
        log.info("✅ User authenticated via {}", provider.getPath());
    }

    /**
     * Signs in to Fastly with a pasted API token, checked against the current user endpoint.
     */
    public FastlyUser authenticateFastlyToken(String token, SessionContext session) {
        if (token == null || token.isBlank()) {
            throw new AuthException("No Fastly API token provided");
        }
        FastlyUser user = fastly.fetchUser(token.trim())
                .orElseThrow(() -> new AuthException("Invalid Fastly API token provided"));
        storeToken(OAuthProvider.FASTLY, token.trim(), session);
        log.info("✅ User authenticated via Fastly: {} (cid {})", user.getName(), user.getCustomerId());
        return user;
    }

    /**
     * Looks up the signed-in users. Absent credentials cost no request; rejected ones read as anonymous.
     */
    public IdentityView resolveIdentities(SessionContext session) {
        LoginState login = session.getLogin();
        GitHubUser githubUser = login.getGithubToken() == null
                ? null
                : github.fetchUser(login.getGithubToken()).orElse(null);
        FastlyUser fastlyUser = login.getFastlyToken() == null
                ? null
                : fastly.fetchUser(login.getFastlyToken()).orElse(null);
        return new IdentityView(githubUser, fastlyUser);
    }

    public String requireGitHubToken(SessionContext session) {
        String token = session.getLogin().getGithubToken();
        if (token == null) {
            throw new AuthException("You must sign in with GitHub first");
        }
        return token;
    }

    public String requireFastlyToken(SessionContext session) {
        String token = session.getLogin().getFastlyToken();
        if (token == null) {
            throw new AuthException("You must sign in with Fastly first");
        }
        return token;
    }

    public void resetLogin(SessionContext session) {
        session.updateLogin(new LoginState());
        log.info("Login state cleared");
    }

    private void storeToken(OAuthProvider provider, String token, SessionContext session) {
        LoginState login = session.getLogin();
        LoginState updated = provider == OAuthProvider.GITHUB
                ? new LoginState(token, login.getFastlyToken())
                : new LoginState(login.getGithubToken(), token);
        session.updateLogin(updated);
    }

    private OAuthProviderSettings configured(OAuthProvider provider) {
        OAuthProviderSettings settings = providers.get(provider);
        if (settings == null || !settings.isConfigured()) {
            throw new PreconditionException("Sign-in with " + provider.getPath() + " is not configured");
        }
        return settings;
    }
}
