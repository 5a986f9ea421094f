package com.example.cronkeeper.service.executor;

import com.example.cronkeeper.config.MetricsConfig;
import com.example.cronkeeper.domain.action.ProcessLauncher;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.exception.WorkTransitionException;
import com.example.cronkeeper.service.WorkHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Service responsible for firing individual due works.
 * <p>
 * Handles:
 * - Logging what each firing did
 * - Marking works whose transition failed as errored
 * - Metrics recording
 */
@Slf4j
@Service
@Profile("daemon")
@RequiredArgsConstructor
public class WorkExecutorService {

    private final ProcessLauncher processLauncher;
    private final MetricsConfig metricsConfig;

    /**
     * Fire a work found due at {@code now}.
     *
     * @param handle The work to fire
     * @param now    Time the work was found due
     * @return true if the transition succeeded, was skipped by policy or was no longer needed
     */
    public boolean executeWork(WorkHandle handle, Instant now) {
        var entryId = handle.getEntryId();
        var name = handle.entryName();

        try {
            var firing = handle.fire(processLauncher, now);
            switch (firing) {
                case NOT_DUE -> log.debug("Entry {} ({}) is no longer due, skipping", name, entryId);
                case STARTED -> log.info("Entry {} ({}) is due, started", name, entryId);
                case STARTED_ANOTHER -> log.info("Entry {} ({}) is due while running, started another process", name, entryId);
                case STOPPED -> log.info("Entry {} ({}) is due while running, stopped", name, entryId);
                case RESTARTED -> log.info("Entry {} ({}) is due while running, restarted", name, entryId);
                case SKIPPED -> log.debug("Entry {} ({}) is due while running, letting it continue", name, entryId);
            }
            if (firing.getPolicy() != null) {
                metricsConfig.recordRunningPolicy(firing.getPolicy());
            }
            if (firing.isSpawning()) {
                metricsConfig.recordStart();
            }
            return true;
        } catch (WorkTransitionException e) {
            log.error("Entry {} ({}) failed while firing, marking as {}: {}", name, entryId, WorkStatus.ERROR, e.getMessage());
            handle.markError();
            metricsConfig.recordFailure(e.getClass().getSimpleName());
            return false;
        }
    }
}
