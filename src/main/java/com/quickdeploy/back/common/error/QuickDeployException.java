package com.quickdeploy.back.common.error;

import org.springframework.http.HttpStatus;

/**
 * Base type for every failure the deploy flow reports to the user.
 * Carries the HTTP status and the short error code used in {@link ErrorResponse}.
 */
public abstract class QuickDeployException extends RuntimeException {

    protected QuickDeployException(String message) {
        super(message);
    }

    protected QuickDeployException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();

    public abstract String getErrorCode();
}
