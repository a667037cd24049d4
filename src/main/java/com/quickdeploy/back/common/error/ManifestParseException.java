package com.quickdeploy.back.common.error;

import org.springframework.http.HttpStatus;

public class ManifestParseException extends QuickDeployException {

    public ManifestParseException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    @Override
    public String getErrorCode() {
        return "MANIFEST_PARSE_ERROR";
    }
}
