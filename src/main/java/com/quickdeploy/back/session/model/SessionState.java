package com.quickdeploy.back.session.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the server knows about a user between requests.
 * Lives only in the client's session cookie.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionState {
    private LoginState login = new LoginState();
    private DeploymentState deployment = new DeploymentState();

    public static SessionState empty() {
        return new SessionState();
    }

    /**
     * Replaces null substructures (e.g. from a hand-edited token) with empty ones.
     */
    public SessionState normalize() {
        if (login == null) {
            login = new LoginState();
        }
        if (deployment == null) {
            deployment = new DeploymentState();
        }
        return this;
    }
}
