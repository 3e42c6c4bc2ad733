package com.filerelay.proxy.service;

import org.springframework.http.HttpStatus;

/**
 * A request the local listener refuses before anything is written to the queue.
 */
public class RelayException extends RuntimeException {
    private final HttpStatus status;

    public RelayException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public RelayException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
