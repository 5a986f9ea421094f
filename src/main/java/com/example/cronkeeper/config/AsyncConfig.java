package com.example.cronkeeper.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools of the daemon.
 * <p>
 * Job transitions run on a fixed pool so that one job's slow spawn or kill does
 * not hold up the due-time checks of the others. The polling loop itself and
 * the delayed shutdown share a small scheduler.
 */
@Slf4j
@Configuration
@Profile("daemon")
public class AsyncConfig {

    /**
     * Executor for work transitions dispatched by the scheduler loop.
     */
    @Bean(name = "workExecutor", destroyMethod = "shutdown")
    public ExecutorService workExecutor(CronkeeperProperties properties) {
        log.info("Creating work executor with {} threads", properties.getExecutorPoolSize());

        return Executors.newFixedThreadPool(properties.getExecutorPoolSize(), new CustomizableThreadFactory("work-executor-"));
    }

    /**
     * Scheduler for the polling loop and the delayed shutdown. Running tasks are
     * not interrupted on close, since the shutdown task is the one closing the
     * context.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("daemon-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        return scheduler;
    }
}
