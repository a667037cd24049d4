package com.quickdeploy.back.deploy.service;

import com.quickdeploy.back.common.error.PreconditionException;
import com.quickdeploy.back.deploy.model.CreatedService;
import com.quickdeploy.back.session.model.DeploymentState;
import com.quickdeploy.back.session.model.SessionContext;
import com.quickdeploy.back.session.model.SessionState;
import com.quickdeploy.back.session.model.WorkflowStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentWorkflowTest {

    private static final String SRC = "fastly/compute-starter-kit-rust-default";
    private static final String DEST = "octocat/compute-starter-kit-rust-default";

    private final DeploymentWorkflow workflow = new DeploymentWorkflow();
    private SessionContext session;

    @BeforeEach
    void setUp() {
        session = new SessionContext(SessionState.empty());
    }

    @Test
    void walksThroughStages() {
        assertThat(workflow.stage(session, SRC)).isEqualTo(WorkflowStage.IDLE);

        workflow.selectSource(session, SRC);
        assertThat(workflow.stage(session, SRC)).isEqualTo(WorkflowStage.SOURCE_SELECTED);

        workflow.recordFork(session, SRC, DEST);
        assertThat(workflow.stage(session, SRC)).isEqualTo(WorkflowStage.FORKED);
        assertThat(workflow.requireDeployable(session, SRC)).isEqualTo(DEST);

        workflow.recordProvisioned(session, new CreatedService("svc-1", "app.edgecompute.app"));
        assertThat(workflow.stage(session, SRC)).isEqualTo(WorkflowStage.PROVISIONED);
        assertThat(workflow.requireServiceId(session)).isEqualTo("svc-1");
        assertThat(session.getDeployment().getDomain()).isEqualTo("app.edgecompute.app");

        workflow.reset(session);
        assertThat(workflow.stage(session, SRC)).isEqualTo(WorkflowStage.IDLE);
        assertThat(session.isModified()).isTrue();
    }

    @Test
    void forkOfAnotherSourceIsNotDeployable() {
        workflow.recordFork(session, SRC, DEST);

        assertThatThrownBy(() -> workflow.requireDeployable(session, "fastly/other-template"))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("No repository has been created from fastly/other-template");
    }

    @Test
    void deployWithoutForkIsRejected() {
        workflow.selectSource(session, SRC);

        assertThatThrownBy(() -> workflow.requireDeployable(session, SRC))
                .isInstanceOf(PreconditionException.class);
    }

    @Test
    void cannotForkOrDeployTwice() {
        workflow.recordFork(session, SRC, DEST);
        assertThatThrownBy(() -> workflow.requireForkable(session, SRC)).isInstanceOf(PreconditionException.class);

        workflow.recordProvisioned(session, new CreatedService("svc-1", "app.edgecompute.app"));
        assertThatThrownBy(() -> workflow.requireDeployable(session, SRC)).isInstanceOf(PreconditionException.class);
    }

    @Test
    void viewingAnotherSourceKeepsForkInFlight() {
        workflow.recordFork(session, SRC, DEST);

        workflow.selectSource(session, "fastly/other-template");

        assertThat(session.getDeployment().getSrc()).isEqualTo(SRC);
        assertThat(session.getDeployment().getDest()).isEqualTo(DEST);
    }

    @Test
    void selectingSameSourceDoesNotTouchSession() {
        session = new SessionContext(new SessionState(null, DeploymentState.builder().src(SRC).build()));

        workflow.selectSource(session, SRC);

        assertThat(session.isModified()).isFalse();
    }

    @Test
    void statusWithoutServiceIsRejected() {
        assertThatThrownBy(() -> workflow.requireServiceId(session))
                .isInstanceOf(PreconditionException.class)
                .hasMessage("No service has been provisioned");
    }
}
