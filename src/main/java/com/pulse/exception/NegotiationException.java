package com.pulse.exception;

public class NegotiationException extends CallException {

    public NegotiationException(String message) {
        super(message);
    }

    public NegotiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
