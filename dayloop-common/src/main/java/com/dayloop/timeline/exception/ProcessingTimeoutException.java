package com.dayloop.timeline.exception;

public class ProcessingTimeoutException extends ProviderException {
    public ProcessingTimeoutException(String message) {
        super(message);
    }
}
