package com.quickdeploy.back.common.error;

import org.springframework.http.HttpStatus;

public class SpecParseException extends QuickDeployException {

    public SpecParseException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    @Override
    public String getErrorCode() {
        return "SPEC_PARSE_ERROR";
    }
}
