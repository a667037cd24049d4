package com.quickdeploy.back.deploy.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploySuccessResponse {
    private String applicationUrl;
    private String actionsUrl;
    private String repoNwo;
    private String serviceId;
}
