package com.quickdeploy.back.deploy.model;

import lombok.Value;

/**
 * Result of a successful provisioning run
 */
@Value
public class CreatedService {
    String id;
    String domain;
}
