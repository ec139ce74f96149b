package com.dayloop.timeline.exception;

public class RemoteProcessingFailedException extends ProviderException {
    public RemoteProcessingFailedException(String message) {
        super(message);
    }
}
