package com.quickdeploy.back.manifest.model;

import lombok.Value;

/**
 * A backend declared under [[setup.backends]]. {@code port} and {@code prompt} may be null.
 */
@Value
public class BackendSpec {

    public static final int DEFAULT_PORT = 80;

    String name;
    String address;
    Integer port;
    String prompt;

    public int portOrDefault() {
        return port == null ? DEFAULT_PORT : port;
    }
}
