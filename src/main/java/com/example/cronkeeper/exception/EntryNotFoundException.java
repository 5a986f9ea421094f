package com.example.cronkeeper.exception;

import lombok.Getter;

/**
 * Exception for an identifier that matches no entry
 */
@Getter
public class EntryNotFoundException extends RuntimeException {

    private final String identifier;

    public EntryNotFoundException(String identifier) {
        super("Entry not found: " + identifier);
        this.identifier = identifier;
    }
}
