package com.quickdeploy.back.deploy.service;

import com.quickdeploy.back.client.fastly.FastlyApi;
import com.quickdeploy.back.client.fastly.FastlyServiceVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One non-blocking check of whether a new service has gone live. The browser re-polls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeploymentStatusPoller {

    private final FastlyApi fastly;

    public boolean isActive(String fastlyToken, String serviceId) {
        FastlyServiceVersion version =
                fastly.getServiceVersion(fastlyToken, serviceId, ProvisioningPipeline.INITIAL_VERSION);
        log.debug("Service {} version {} active={}", serviceId, ProvisioningPipeline.INITIAL_VERSION, version.isActive());
        return version.isActive();
    }
}
