package com.quickdeploy.back.deploy.model;

import com.quickdeploy.back.client.github.GitHubFile;
import com.quickdeploy.back.manifest.model.DeployConfigSpec;
import com.quickdeploy.back.manifest.model.EditableManifest;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.Map;

/**
 * Everything one provisioning run needs.
 */
@Data
@Builder
public class ProvisioningRequest {
    /** Repository (owner/name) the service is provisioned for */
    private String destination;

    /** Manifest as read from {@code destination}; its sha guards the final write */
    @ToString.Exclude
    private GitHubFile manifestFile;

    @ToString.Exclude
    private EditableManifest manifest;

    private DeployConfigSpec spec;

    /** User supplied dictionary values keyed by "dictionary.key" */
    private Map<String, String> overrides;

    @ToString.Exclude
    private String githubToken;

    @ToString.Exclude
    private String fastlyToken;

    /** Pre-selected service name, null to generate one */
    private String serviceName;
}
