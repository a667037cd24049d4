package com.quickdeploy.back.deploy.model;

import com.quickdeploy.back.client.fastly.FastlyUser;
import com.quickdeploy.back.client.github.GitHubRepository;
import com.quickdeploy.back.client.github.GitHubUser;
import com.quickdeploy.back.manifest.model.DeployConfigSpec;
import com.quickdeploy.back.session.model.WorkflowStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * View model of the deploy wizard for one source repository
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeployPageResponse {
    private GitHubRepository src;
    private String destNwo;
    private GitHubUser githubUser;
    private FastlyUser fastlyUser;
    private boolean canFork;
    private boolean canDeploy;
    private WorkflowStage stage;

    /**
     * Resources the template asks for, null when it has no manifest
     */
    private DeployConfigSpec configSpec;
}
