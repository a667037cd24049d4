package com.quickdeploy.back.common.error;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends QuickDeployException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
