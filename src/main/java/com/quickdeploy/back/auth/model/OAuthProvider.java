package com.quickdeploy.back.auth.model;

import com.quickdeploy.back.common.error.ResourceNotFoundException;

import java.util.Arrays;

/**
 * Identity providers a user signs in with, named as they appear in /oauth/{provider} paths.
 */
public enum OAuthProvider {
    GITHUB("github"),
    FASTLY("fastly");

    private final String path;

    OAuthProvider(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    public static OAuthProvider fromPath(String path) {
        return Arrays.stream(values())
                .filter(p -> p.path.equalsIgnoreCase(path))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Unknown identity provider: " + path));
    }
}
