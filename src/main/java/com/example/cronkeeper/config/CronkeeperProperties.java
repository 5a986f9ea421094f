package com.example.cronkeeper.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the daemon and the CLI.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "cronkeeper")
public class CronkeeperProperties {

    /**
     * Persisted entries, listen address and token
     */
    @NotNull
    private Path configPath = Path.of(System.getProperty("user.home"), ".config", "cronkeeper", "config.json");

    /**
     * Delay in milliseconds between two due-time checks
     */
    @Min(100)
    private long pollIntervalMs = 1000;

    /**
     * Number of threads performing job transitions
     */
    @Min(1)
    private int executorPoolSize = 8;

    /**
     * Directory for job output when an entry logs to the default location
     */
    @NotNull
    private Path outputDir = Path.of(System.getProperty("java.io.tmpdir"), "cronkeeper");

    /**
     * Working directory of jobs that do not name one
     */
    @NotNull
    private Path defaultWorkingDir = Path.of(System.getProperty("java.io.tmpdir"));

    /**
     * Command prefix running a job as another account; the user name and "--" are appended
     */
    @NotEmpty
    private List<String> runAsCommand = new ArrayList<>(List.of("sudo", "-n", "-E", "-u"));

    /**
     * Account database consulted when an entry names a user
     */
    @NotNull
    private Path passwdFile = Path.of("/etc/passwd");

    /**
     * Timeout of a single CLI request to the daemon
     */
    @Min(1)
    private int clientTimeoutSeconds = 10;
}
