package com.example.cronkeeper.exception;

/**
 * Exception for a due time that cannot be computed, e.g. one landing in a DST gap
 */
public class InvalidTimeException extends WorkTransitionException {

    public InvalidTimeException(String entryName, String reason) {
        super(entryName, String.format("Invalid time for entry %s: %s", entryName, reason));
    }
}
