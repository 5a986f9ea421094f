package com.example.cronkeeper.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception for job processes that could not be terminated.
 * Carries every failed pid when a stop signalled several processes.
 */
@Getter
public class ProcessSignalException extends WorkTransitionException {

    private final List<Long> pids;

    public ProcessSignalException(String entryName, long pid, String reason) {
        super(entryName, String.format("Failed to kill process %d of entry %s: %s", pid, entryName, reason));
        this.pids = List.of(pid);
    }

    public ProcessSignalException(String entryName, List<ProcessSignalException> failures) {
        super(entryName, String.format("Failed to kill %d process(es) of entry %s: %s", failures.size(), entryName,
                String.join("; ", failures.stream().map(Throwable::getMessage).toList())));
        this.pids = failures.stream().flatMap(f -> f.getPids().stream()).toList();
        failures.forEach(this::addSuppressed);
    }
}
