package com.example.cronkeeper.domain.repository;

import com.example.cronkeeper.config.CronkeeperProperties;
import com.example.cronkeeper.domain.entity.DaemonConfig;
import com.example.cronkeeper.exception.ConfigPersistenceException;
import com.example.cronkeeper.util.RandomStrings;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;

/**
 * Keeps the daemon configuration in a single JSON file.
 * <p>
 * Writes go to a temp file in the same directory which is then moved over the
 * target, so a concurrent reader sees either the old or the new content.
 */
@Slf4j
@Repository
public class JsonFileConfigRepository implements ConfigRepository {

    private final Path path;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileConfigRepository(CronkeeperProperties properties, ObjectMapper objectMapper) {
        this(properties.getConfigPath(), objectMapper);
    }

    public JsonFileConfigRepository(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public DaemonConfig load() {
        if (!Files.exists(path)) {
            log.info("Config file {} not found, creating defaults", path);
            var config = DaemonConfig.builder()
                    .address(DaemonConfig.DEFAULT_ADDRESS)
                    .token(RandomStrings.token())
                    .build();
            save(config);
            return config;
        }

        DaemonConfig config;
        try {
            config = objectMapper.readValue(path.toFile(), DaemonConfig.class);
        } catch (IOException e) {
            throw new ConfigPersistenceException(path, e);
        }

        var changed = false;
        if (config.getEntries() == null) {
            config.setEntries(new ArrayList<>());
        }
        if (config.getAddress() == null || config.getAddress().isBlank()) {
            config.setAddress(DaemonConfig.DEFAULT_ADDRESS);
            changed = true;
        }
        if (config.getToken() == null || config.getToken().isBlank()) {
            log.info("Config file {} has no token, generating one", path);
            config.setToken(RandomStrings.token());
            changed = true;
        }
        if (changed) {
            save(config);
        }
        log.debug("Loaded {} entries from {}", config.getEntries().size(), path);
        return config;
    }

    @Override
    public void save(DaemonConfig config) {
        try {
            var dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            var tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), config);
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new ConfigPersistenceException(path, e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to a plain replace", path);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
