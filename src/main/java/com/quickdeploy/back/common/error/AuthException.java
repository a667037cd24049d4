package com.quickdeploy.back.common.error;

import org.springframework.http.HttpStatus;

/**
 * Missing or invalid credential, or an authorization code the provider refused.
 */
public class AuthException extends QuickDeployException {

    public AuthException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNAUTHORIZED;
    }

    @Override
    public String getErrorCode() {
        return "AUTH_ERROR";
    }
}
