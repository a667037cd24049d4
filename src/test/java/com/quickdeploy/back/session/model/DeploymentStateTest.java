package com.quickdeploy.back.session.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeploymentStateTest {

    @Test
    void destinationOnlyResolvesForItsSource() {
        DeploymentState state = DeploymentState.builder().src("a/b").dest("me/b").build();

        assertThat(state.resolveDestination("a/b")).contains("me/b");
        assertThat(state.resolveDestination("c/d")).isEmpty();
    }

    @Test
    void stageFollowsRecordedProgress() {
        assertThat(new DeploymentState().stageFor("a/b")).isEqualTo(WorkflowStage.IDLE);
        assertThat(DeploymentState.builder().src("a/b").build().stageFor("a/b"))
                .isEqualTo(WorkflowStage.SOURCE_SELECTED);
        assertThat(DeploymentState.builder().src("a/b").dest("me/b").build().stageFor("a/b"))
                .isEqualTo(WorkflowStage.FORKED);
        assertThat(DeploymentState.builder().src("a/b").dest("me/b").serviceId("svc").build().stageFor("a/b"))
                .isEqualTo(WorkflowStage.PROVISIONED);
    }

    @Test
    void forkOfAnotherSourceReadsAsIdle() {
        DeploymentState state = DeploymentState.builder().src("a/b").dest("me/b").serviceId("svc").build();

        assertThat(state.stageFor("c/d")).isEqualTo(WorkflowStage.IDLE);
    }
}
