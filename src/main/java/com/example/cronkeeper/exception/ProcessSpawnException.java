package com.example.cronkeeper.exception;

import lombok.Getter;

/**
 * Exception for a job process the OS refused to start
 */
@Getter
public class ProcessSpawnException extends WorkTransitionException {

    private final String executable;

    public ProcessSpawnException(String entryName, String executable, Exception cause) {
        super(entryName, String.format("Failed to spawn %s for entry %s: %s", executable, entryName, cause.getMessage()), cause);
        this.executable = executable;
    }
}
