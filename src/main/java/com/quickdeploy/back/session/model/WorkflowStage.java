package com.quickdeploy.back.session.model;

/**
 * Stage of a user's deployment, derived from {@link DeploymentState}.
 * There is no ACTIVE stage: the poll that sees the service go live resets the state to IDLE.
 */
public enum WorkflowStage {
    IDLE,
    SOURCE_SELECTED,
    FORKED,
    PROVISIONED
}
