package com.quickdeploy.back.common.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns any failure escaping a handler into an {@link ErrorResponse} carrying its message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(QuickDeployException.class)
    public ResponseEntity<ErrorResponse> handleQuickDeploy(QuickDeployException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("❌ {}: {}", e.getErrorCode(), e.getMessage());
        } else {
            log.warn("{}: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatus())
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("BAD_REQUEST", "No '" + e.getParameterName() + "' param provided"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.internalServerError()
                .body(new ErrorResponse("INTERNAL_ERROR", e.getMessage()));
    }
}
