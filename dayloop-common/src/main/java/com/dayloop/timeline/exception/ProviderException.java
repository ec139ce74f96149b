package com.dayloop.timeline.exception;

/**
 * Transport or content failure from an analysis provider. The message ends up
 * verbatim in the failed batch's reason.
 */
public class ProviderException extends RuntimeException {

    private final Integer httpStatus;

    public ProviderException(String message) {
        this(message, null, null);
    }

    public ProviderException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ProviderException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
