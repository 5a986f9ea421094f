package com.example.cronkeeper.service.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Closes the application once a stop was requested, after a short grace period
 * that lets the control plane answer the request. Running job processes are left
 * alone.
 */
@Slf4j
@Component
@Profile("daemon")
@RequiredArgsConstructor
public class DaemonShutdownListener {

    private final ConfigurableApplicationContext context;
    private final TaskScheduler taskScheduler;

    @Value("${cronkeeper.shutdown-grace-ms:500}")
    private long shutdownGraceMs;

    @EventListener
    public void onStopRequested(DaemonStopRequestedEvent event) {
        log.info("Daemon stop requested, shutting down in {}ms", shutdownGraceMs);

        taskScheduler.schedule(this::shutdown, Instant.now().plusMillis(shutdownGraceMs));
    }

    private void shutdown() {
        context.close();
        log.info("Daemon stopped");
    }
}
