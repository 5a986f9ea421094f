package com.example.cronkeeper;

import com.example.cronkeeper.cli.OperationParser;
import com.example.cronkeeper.cli.OperationType;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

/**
 * Cronkeeper Application
 * <p>
 * A cron-like job scheduling daemon plus the CLI that manages it.
 * <p>
 * Features:
 * - Repeating, one-shot and bounded timers with calendar arithmetic
 * - Per-job locking so slow spawns and kills never hold up other jobs
 * - Running-conflict policies (start new, stop, restart, continue)
 * - Token-authenticated HTTP control plane
 * <p>
 * {@code start-daemon} boots the daemon profile; every other operation boots the
 * cli profile, runs once and exits.
 */
@EnableScheduling
@SpringBootApplication
public class CronkeeperApplication {

    public static void main(String[] args) {
        var application = new SpringApplication(CronkeeperApplication.class);
        application.setAddCommandLineProperties(false);

        if (isDaemon(args)) {
            application.setAdditionalProfiles("daemon");
            application.run(args);
            return;
        }

        application.setAdditionalProfiles("cli");
        application.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(application.run(args)));
    }

    static boolean isDaemon(String[] args) {
        return args.length > 0
                && OperationType.START_DAEMON.getCommand().equals(args[0])
                && !OperationParser.wantsHelp(Arrays.asList(args));
    }
}
