package com.example.cronkeeper.domain.action;

import com.example.cronkeeper.exception.ProcessSignalException;
import com.example.cronkeeper.exception.ProcessSpawnException;

/**
 * Spawns and kills the OS processes behind {@link Action.Exec} actions.
 */
public interface ProcessLauncher {

    /**
     * Start a process described by the given {@link Execute}.
     *
     * @param entryName name of the owning entry, used for logging and output file naming
     * @throws ProcessSpawnException if the OS refuses to start the process
     */
    SpawnedProcess spawn(String entryName, Execute execute, OutputLog output);

    /**
     * Forcibly terminate a tracked process.
     *
     * @throws ProcessSignalException if the process is gone or termination was refused
     */
    void kill(String entryName, SpawnedProcess process);

    /**
     * Whether the process is still running
     */
    boolean isAlive(SpawnedProcess process);
}
