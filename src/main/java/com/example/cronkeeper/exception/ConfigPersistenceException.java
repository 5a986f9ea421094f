package com.example.cronkeeper.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Exception for a config file that cannot be read or written
 */
@Getter
public class ConfigPersistenceException extends RuntimeException {

    private final Path path;

    public ConfigPersistenceException(Path path, Exception cause) {
        super(String.format("Cannot access config file %s: %s", path, cause.getMessage()), cause);
        this.path = path;
    }
}
