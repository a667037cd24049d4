package com.quickdeploy.back.session.model;

import lombok.Getter;

/**
 * Per-request view of the session, built from the cookie at the top of a handler
 * and passed explicitly to every service that reads or changes it.
 * Handlers re-emit the cookie when {@link #isModified()} is set.
 */
@Getter
public class SessionContext {
    private final SessionState state;
    private boolean modified;

    public SessionContext(SessionState state) {
        this.state = state == null ? SessionState.empty() : state.normalize();
    }

    public LoginState getLogin() {
        return state.getLogin();
    }

    public DeploymentState getDeployment() {
        return state.getDeployment();
    }

    public void updateLogin(LoginState login) {
        state.setLogin(login);
        modified = true;
    }

    public void updateDeployment(DeploymentState deployment) {
        state.setDeployment(deployment);
        modified = true;
    }
}
