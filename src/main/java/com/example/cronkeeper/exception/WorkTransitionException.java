package com.example.cronkeeper.exception;

import lombok.Getter;

/**
 * Base for a failed start, stop or restart of one work
 */
@Getter
public class WorkTransitionException extends RuntimeException {

    private final String entryName;

    public WorkTransitionException(String entryName, String message) {
        super(message);
        this.entryName = entryName;
    }

    public WorkTransitionException(String entryName, String message, Throwable cause) {
        super(message, cause);
        this.entryName = entryName;
    }
}
