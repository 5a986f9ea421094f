package com.example.cronkeeper.exception;

/**
 * Exception for a control-plane request whose token does not match the daemon's
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException() {
        super("Invalid token");
    }
}
