package com.quickdeploy.back.deploy.service;

import com.quickdeploy.back.common.error.PreconditionException;
import com.quickdeploy.back.deploy.model.CreatedService;
import com.quickdeploy.back.session.model.DeploymentState;
import com.quickdeploy.back.session.model.SessionContext;
import com.quickdeploy.back.session.model.WorkflowStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Transitions of a user's deployment, IDLE -> SOURCE_SELECTED -> FORKED -> PROVISIONED -> IDLE.
 * Every change goes through here and lands in the session's {@link DeploymentState}.
 */
@Slf4j
@Component
public class DeploymentWorkflow {

    public WorkflowStage stage(SessionContext session, String srcNwo) {
        return session.getDeployment().stageFor(srcNwo);
    }

    /**
     * Remembers the source being viewed, unless a fork is already in flight.
     */
    public void selectSource(SessionContext session, String srcNwo) {
        DeploymentState current = session.getDeployment();
        if (current.getDest() != null || current.getServiceId() != null || srcNwo.equals(current.getSrc())) {
            return;
        }
        session.updateDeployment(DeploymentState.builder().src(srcNwo).build());
    }

    public void requireForkable(SessionContext session, String srcNwo) {
        WorkflowStage stage = stage(session, srcNwo);
        if (stage == WorkflowStage.FORKED || stage == WorkflowStage.PROVISIONED) {
            throw new PreconditionException("A repository has already been created from " + srcNwo
                    + ": " + session.getDeployment().getDest());
        }
    }

    /**
     * Replaces whatever was in flight with a fresh fork of {@code srcNwo}.
     */
    public void recordFork(SessionContext session, String srcNwo, String destNwo) {
        session.updateDeployment(DeploymentState.builder().src(srcNwo).dest(destNwo).build());
        log.info("Recorded fork {} -> {}", srcNwo, destNwo);
    }

    /**
     * @return the destination repository, which must be forked from {@code srcNwo} and not yet provisioned
     */
    public String requireDeployable(SessionContext session, String srcNwo) {
        WorkflowStage stage = stage(session, srcNwo);
        if (stage == WorkflowStage.PROVISIONED) {
            throw new PreconditionException("A service has already been provisioned for " + srcNwo
                    + "; reset the deployment to start again");
        }
        return session.getDeployment().resolveDestination(srcNwo)
                .orElseThrow(() -> new PreconditionException("No repository has been created from " + srcNwo + " yet"));
    }

    public void recordProvisioned(SessionContext session, CreatedService service) {
        DeploymentState current = session.getDeployment();
        session.updateDeployment(DeploymentState.builder()
                .src(current.getSrc())
                .dest(current.getDest())
                .serviceId(service.getId())
                .domain(service.getDomain())
                .build());
    }

    public String requireServiceId(SessionContext session) {
        String serviceId = session.getDeployment().getServiceId();
        if (serviceId == null) {
            throw new PreconditionException("No service has been provisioned");
        }
        return serviceId;
    }

    public void reset(SessionContext session) {
        session.updateDeployment(new DeploymentState());
        log.info("Deployment state cleared");
    }
}
