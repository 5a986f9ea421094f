package com.example.cronkeeper.domain.action;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One OS process started by a work.
 */
@Value
@AllArgsConstructor
public class SpawnedProcess {

    long pid;

    /**
     * Start time reported by the OS, null when unknown. Tells a reused pid apart
     * from the process that was spawned.
     */
    Instant startedAt;

    /**
     * Output file created for this run, null unless the entry logs to the default location
     */
    Path outputTmpFile;

    public SpawnedProcess(long pid, Path outputTmpFile) {
        this(pid, null, outputTmpFile);
    }
}
