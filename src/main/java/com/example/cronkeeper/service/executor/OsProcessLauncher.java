package com.example.cronkeeper.service.executor;

import com.example.cronkeeper.config.CronkeeperProperties;
import com.example.cronkeeper.domain.action.Execute;
import com.example.cronkeeper.domain.action.OutputLog;
import com.example.cronkeeper.domain.action.ProcessLauncher;
import com.example.cronkeeper.domain.action.SpawnedProcess;
import com.example.cronkeeper.exception.ProcessSignalException;
import com.example.cronkeeper.exception.ProcessSpawnException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ProcessLauncher} on top of {@link ProcessBuilder} and {@link ProcessHandle}.
 * <p>
 * Handles:
 * - Environment merged over the daemon's own
 * - Default working directory
 * - Running as another account through the configured command prefix
 * - Output redirection per {@link OutputLog}
 */
@Slf4j
@Component
public class OsProcessLauncher implements ProcessLauncher {

    private final CronkeeperProperties properties;
    private final String daemonUser;

    @Autowired
    public OsProcessLauncher(CronkeeperProperties properties) {
        this(properties, System.getProperty("user.name"));
    }

    OsProcessLauncher(CronkeeperProperties properties, String daemonUser) {
        this.properties = properties;
        this.daemonUser = daemonUser;
    }

    @Override
    public SpawnedProcess spawn(String entryName, Execute execute, OutputLog output) {
        if (execute.getExecutable() == null || execute.getExecutable().isBlank()) {
            throw new ProcessSpawnException(entryName, execute.getExecutable(), new IllegalArgumentException("no executable given"));
        }
        var command = buildCommand(execute);
        var workingDir = execute.getWorkingDir() != null && !execute.getWorkingDir().isBlank()
                ? Path.of(execute.getWorkingDir())
                : properties.getDefaultWorkingDir();

        var builder = new ProcessBuilder(command).directory(workingDir.toFile());
        if (execute.getEnv() != null) {
            builder.environment().putAll(execute.getEnv());
        }

        try {
            var outputFile = redirectOutput(builder, entryName, output);
            var process = builder.start();
            process.getOutputStream().close();

            log.info("Spawned process {} for entry {}: {}", process.pid(), entryName, command);
            return new SpawnedProcess(process.pid(), process.toHandle().info().startInstant().orElse(null), outputFile);
        } catch (IOException e) {
            log.error("Failed to spawn {} for entry {} in {}: {}", command, entryName, workingDir, e.getMessage());
            throw new ProcessSpawnException(entryName, execute.getExecutable(), e);
        }
    }

    @Override
    public void kill(String entryName, SpawnedProcess process) {
        var pid = process.getPid();
        var handle = liveHandle(process)
                .orElseThrow(() -> new ProcessSignalException(entryName, pid, "no such process"));

        handle.descendants().forEach(ProcessHandle::destroyForcibly);
        if (!handle.destroyForcibly()) {
            throw new ProcessSignalException(entryName, pid, "termination refused");
        }
        log.info("Killed process {} of entry {}", pid, entryName);
    }

    @Override
    public boolean isAlive(SpawnedProcess process) {
        return liveHandle(process).isPresent();
    }

    /**
     * The live OS process behind {@code process}. A pid now held by a process
     * started at another time counts as gone.
     */
    private static Optional<ProcessHandle> liveHandle(SpawnedProcess process) {
        return ProcessHandle.of(process.getPid())
                .filter(ProcessHandle::isAlive)
                .filter(handle -> process.getStartedAt() == null || handle.info().startInstant()
                        .map(process.getStartedAt()::equals)
                        .orElse(true));
    }

    List<String> buildCommand(Execute execute) {
        var command = new ArrayList<String>();
        var user = execute.getUser();
        if (user != null && !user.username().equals(daemonUser)) {
            command.addAll(properties.getRunAsCommand());
            command.add(user.username());
            command.add("--");
        }
        command.add(execute.getExecutable());
        if (execute.getArgs() != null) {
            command.addAll(execute.getArgs());
        }
        return command;
    }

    /**
     * @return the per-run output file, null unless output goes to the default location
     */
    private Path redirectOutput(ProcessBuilder builder, String entryName, OutputLog output) throws IOException {
        if (output instanceof OutputLog.File file) {
            var path = Path.of(file.path()).toAbsolutePath();
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            builder.redirectErrorStream(true);
            builder.redirectOutput(ProcessBuilder.Redirect.appendTo(path.toFile()));
            return null;
        }
        if (output instanceof OutputLog.Off) {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            builder.redirectError(ProcessBuilder.Redirect.DISCARD);
            return null;
        }

        Files.createDirectories(properties.getOutputDir());
        var outputFile = Files.createTempFile(properties.getOutputDir(), fileSafe(entryName) + "-", ".log");
        builder.redirectErrorStream(true);
        builder.redirectOutput(outputFile.toFile());
        return outputFile;
    }

    private static String fileSafe(String entryName) {
        return entryName == null ? "entry" : entryName.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
