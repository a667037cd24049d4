package com.quickdeploy.back.common.error;

import org.springframework.http.HttpStatus;

public class NotATemplateException extends QuickDeployException {

    public NotATemplateException(String nwo) {
        super("The repository " + nwo + " is not a template repository, so cannot be deployed via Quick Deploy");
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    @Override
    public String getErrorCode() {
        return "NOT_A_TEMPLATE";
    }
}
