package com.example.cronkeeper.exception;

import lombok.Getter;

/**
 * Exception for a daemon response the client cannot interpret
 */
@Getter
public class DaemonResponseException extends RuntimeException {

    private final String address;

    public DaemonResponseException(String address, String message) {
        super(String.format("Unexpected response from daemon, Addr: %s, Err: %s", address, message));
        this.address = address;
    }

    public DaemonResponseException(String address, Exception cause) {
        super(String.format("Unexpected response from daemon, Addr: %s, Err: %s", address, cause.getMessage()), cause);
        this.address = address;
    }
}
