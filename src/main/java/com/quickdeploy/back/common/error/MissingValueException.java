package com.quickdeploy.back.common.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A dictionary item had neither a submitted value nor a declared default.
 */
@Getter
public class MissingValueException extends QuickDeployException {

    private final String key;

    public MissingValueException(String key) {
        super("No value provided for dictionary key " + key);
        this.key = key;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    @Override
    public String getErrorCode() {
        return "MISSING_VALUE";
    }
}
