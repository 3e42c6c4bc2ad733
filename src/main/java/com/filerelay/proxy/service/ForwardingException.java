package com.filerelay.proxy.service;

/**
 * The backend could not be reached, or the command that reaches it failed.
 * An HTTP error status from the backend is a response, not this exception.
 */
public class ForwardingException extends RuntimeException {

    public ForwardingException(String message) {
        super(message);
    }

    public ForwardingException(String message, Throwable cause) {
        super(message, cause);
    }
}
