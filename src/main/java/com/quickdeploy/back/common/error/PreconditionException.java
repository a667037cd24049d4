package com.quickdeploy.back.common.error;

import org.springframework.http.HttpStatus;

/**
 * A workflow step was invoked before the fact it depends on was established,
 * e.g. a status check with no provisioned service.
 */
public class PreconditionException extends QuickDeployException {

    public PreconditionException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public String getErrorCode() {
        return "PRECONDITION_FAILED";
    }
}
