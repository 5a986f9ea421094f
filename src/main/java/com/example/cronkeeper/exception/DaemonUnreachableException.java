package com.example.cronkeeper.exception;

import lombok.Getter;

/**
 * Exception for a daemon that could not be reached at all. Retried by the client.
 */
@Getter
public class DaemonUnreachableException extends RuntimeException {

    private final String address;

    public DaemonUnreachableException(String address, Exception cause) {
        super(String.format("Cannot connect to daemon, Addr: %s, Err: %s", address, cause.getMessage()), cause);
        this.address = address;
    }
}
