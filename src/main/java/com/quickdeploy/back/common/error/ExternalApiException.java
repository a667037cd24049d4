package com.quickdeploy.back.common.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Non-success response (or transport failure) from GitHub or Fastly.
 * The provider's response body is kept verbatim in the message.
 */
@Getter
public class ExternalApiException extends QuickDeployException {

    /** Status code returned by the provider, or -1 when no response was received. */
    private final int providerStatus;
    private final String provider;

    public ExternalApiException(String provider, int providerStatus, String message) {
        super(message);
        this.provider = provider;
        this.providerStatus = providerStatus;
    }

    public ExternalApiException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.providerStatus = -1;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }

    @Override
    public String getErrorCode() {
        return "EXTERNAL_API_ERROR";
    }
}
