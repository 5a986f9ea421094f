package com.example.cronkeeper.domain.repository;

import com.example.cronkeeper.domain.entity.DaemonConfig;
import com.example.cronkeeper.exception.ConfigPersistenceException;

/**
 * Storage of the persisted daemon configuration.
 */
public interface ConfigRepository {

    /**
     * Load the configuration, creating and persisting defaults for whatever is missing.
     *
     * @throws ConfigPersistenceException if the storage cannot be read or written
     */
    DaemonConfig load();

    /**
     * Replace the stored configuration. Readers never observe a partial write.
     *
     * @throws ConfigPersistenceException if the storage cannot be written
     */
    void save(DaemonConfig config);
}
