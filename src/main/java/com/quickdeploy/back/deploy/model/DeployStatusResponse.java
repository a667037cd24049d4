package com.quickdeploy.back.deploy.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one deployment status poll
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeployStatusResponse {
    private String serviceId;

    /**
     * Whether version 1 of the service is active.
     * Once true the deployment state has been reset.
     */
    private boolean active;

    private String applicationUrl;
}
