package com.example.cronkeeper.service.executor;

import com.example.cronkeeper.domain.action.ProcessLauncher;
import com.example.cronkeeper.service.DaemonRuntime;
import com.example.cronkeeper.service.WorkHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Service responsible for checking which works are due and dispatching them.
 * <p>
 * Flow:
 * 1. Poll job runs on a fixed delay (default every second)
 * 2. Forgets tracked processes that have exited
 * 3. Selects the works whose due time is up
 * 4. Dispatches each to the work executor pool and waits for the batch
 * <p>
 * Each due check takes only the read lock of one work at a time, so a work in
 * the middle of a slow transition does not hold up the others.
 */
@Slf4j
@Service
@Profile("daemon")
public class WorkPollingService {

    private final DaemonRuntime daemonRuntime;
    private final WorkExecutorService workExecutorService;
    private final ProcessLauncher processLauncher;
    private final ExecutorService workExecutor;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public WorkPollingService(DaemonRuntime daemonRuntime, WorkExecutorService workExecutorService, ProcessLauncher processLauncher,
                              @Qualifier("workExecutor") ExecutorService workExecutor) {
        this.daemonRuntime = daemonRuntime;
        this.workExecutorService = workExecutorService;
        this.processLauncher = processLauncher;
        this.workExecutor = workExecutor;
    }

    @Scheduled(fixedDelayString = "${cronkeeper.poll-interval-ms:1000}")
    public void pollAndDispatch() {
        if (!daemonRuntime.isRunning()) {
            log.debug("Daemon is stopped, skipping polling cycle");
            return;
        }
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return;
        }

        try {
            var works = daemonRuntime.works();

            var reaped = works.stream().mapToInt(handle -> handle.reapExited(processLauncher)).sum();
            if (reaped > 0) {
                log.debug("Forgot {} exited process(es)", reaped);
            }

            var now = Instant.now();
            var due = works.stream().filter(handle -> handle.isDue(now)).toList();
            if (due.isEmpty()) {
                log.debug("No works due");
                return;
            }

            log.debug("Found {} due works", due.size());

            var futures = due.stream()
                    .map(handle -> CompletableFuture.supplyAsync(() -> processWork(handle, now), workExecutor))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .exceptionally(ex -> {
                        log.error("Error waiting for work transitions: {}", ex.getMessage());
                        return null;
                    })
                    .join();

            var successCount = futures.stream()
                    .filter(f -> !f.isCompletedExceptionally() && f.join())
                    .count();

            log.debug("Fired {} works, {} successful", due.size(), successCount);
        } catch (Exception e) {
            log.error("Error in polling cycle: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    private boolean processWork(WorkHandle handle, Instant now) {
        try {
            return workExecutorService.executeWork(handle, now);
        } catch (Exception e) {
            log.error("Error firing entry {}: {}", handle.getEntryId(), e.getMessage(), e);
            return false;
        }
    }
}
