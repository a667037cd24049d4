package com.quickdeploy.back.auth.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.quickdeploy.back.client.fastly.FastlyUser;
import com.quickdeploy.back.client.github.GitHubUser;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Who the current request is signed in as on each provider. A null user means anonymous.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdentityView {
    private GitHubUser githubUser;
    private FastlyUser fastlyUser;

    public static IdentityView anonymous() {
        return new IdentityView();
    }

    @JsonIgnore
    public boolean isGithubAuthenticated() {
        return githubUser != null;
    }

    @JsonIgnore
    public boolean isFastlyAuthenticated() {
        return fastlyUser != null;
    }
}
