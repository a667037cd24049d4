package com.quickdeploy.back.deploy.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resources created so far by one provisioning run. Never outlives the run.
 */
@Data
public class ProvisioningRun {
    private final ProvisioningRequest request;
    private final List<ProvisioningStep> completedSteps = new ArrayList<>();

    private String serviceName;
    private String serviceId;
    private String domain;
    private final List<String> backends = new ArrayList<>();
    /** dictionary name -> id */
    private final Map<String, String> dictionaryIds = new LinkedHashMap<>();
    private String publicKeyId;
}
