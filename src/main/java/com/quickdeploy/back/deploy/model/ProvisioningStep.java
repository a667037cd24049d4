package com.quickdeploy.back.deploy.model;

/**
 * Steps of a provisioning run. Declaration order is execution order.
 */
public enum ProvisioningStep {
    NAME_SERVICE,
    CREATE_SERVICE,
    CREATE_DOMAIN,
    CREATE_BACKENDS,
    CREATE_DICTIONARIES,
    ENABLE_WORKFLOW,
    CREATE_SECRET,
    PUSH_MANIFEST
}
