package com.example.cronkeeper.cli;

import com.example.cronkeeper.client.DaemonClient;
import com.example.cronkeeper.domain.action.Action;
import com.example.cronkeeper.domain.repository.ConfigRepository;
import com.example.cronkeeper.domain.time.DateTime;
import com.example.cronkeeper.domain.time.Duration;
import com.example.cronkeeper.domain.trigger.Timer;
import com.example.cronkeeper.domain.trigger.Trigger;
import com.example.cronkeeper.dto.ControlResponse;
import com.example.cronkeeper.dto.WorkResponse;
import com.example.cronkeeper.exception.ConfigPersistenceException;
import com.example.cronkeeper.exception.DaemonResponseException;
import com.example.cronkeeper.exception.DaemonUnreachableException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one CLI operation against the daemon and reports the outcome.
 * <p>
 * User-facing output goes through the log, which the cli profile prints as bare
 * lines. The exit code is 0 on success and 1 on any reported failure.
 */
@Slf4j
@Component
@Profile("cli")
@RequiredArgsConstructor
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final TypeReference<List<WorkResponse>> WORK_LIST = new TypeReference<>() {
    };

    private final OperationParser operationParser;
    private final DaemonClient daemonClient;
    private final ConfigRepository configRepository;
    private final ObjectMapper objectMapper;

    @Value("${cronkeeper.version:unknown}")
    private String version;

    private int exitCode = 0;

    @Override
    public void run(String... args) {
        try {
            exitCode = handle(operationParser.parse(Arrays.asList(args))) ? 0 : 1;
        } catch (IllegalArgumentException e) {
            log.error("Error: {}", e.getMessage());
            exitCode = 1;
        } catch (DaemonUnreachableException | DaemonResponseException | ConfigPersistenceException e) {
            log.error("Error: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    boolean handle(Operation operation) {
        if (operation instanceof Operation.Help help) {
            log.info(help.topic() == null ? OperationType.generalHelp() : help.topic().getHelp());
            return true;
        }
        if (operation instanceof Operation.Version) {
            log.info("cronkeeper {}", version);
            return true;
        }
        if (operation instanceof Operation.StartDaemon) {
            log.error("Error: start-daemon must be the first argument");
            return false;
        }

        var daemon = configRepository.load();
        if (operation instanceof Operation.Add add) {
            return report(daemonClient.call(daemon, "/api/addEntries", List.of(add.entry())),
                    data -> "Entry added: " + names(data));
        }
        if (operation instanceof Operation.Delete delete) {
            return report(daemonClient.call(daemon, "/api/deleteEntries", delete.identifier()),
                    data -> "Deleted " + data.asInt() + " entr(ies)");
        }
        if (operation instanceof Operation.Start start) {
            return report(daemonClient.call(daemon, "/api/startEntries", start.identifier()), JsonNode::asText);
        }
        if (operation instanceof Operation.Pause pause) {
            return report(daemonClient.call(daemon, "/api/pauseEntries", pause.identifier()), JsonNode::asText);
        }
        if (operation instanceof Operation.StopDaemon) {
            return report(daemonClient.call(daemon, "/api/stopDaemon"), JsonNode::asText);
        }
        if (operation instanceof Operation.ListEntries) {
            return report(daemonClient.call(daemon, "/api/listEntries"), data -> renderTable(toWorks(data)));
        }
        if (operation instanceof Operation.Detail detail) {
            return report(daemonClient.call(daemon, "/api/detailEntry", detail.identifier()), data -> renderDetails(toWorks(data)));
        }
        throw new IllegalStateException("Unhandled operation: " + operation);
    }

    private boolean report(ControlResponse<JsonNode> response, Function<JsonNode, String> render) {
        if (!response.isSuccess()) {
            var message = response.getData() == null ? "" : response.getData().asText();
            log.error("Error ({}): {}", response.getCode(), message);
            return false;
        }
        log.info(render.apply(response.getData()));
        return true;
    }

    private List<WorkResponse> toWorks(JsonNode data) {
        return objectMapper.convertValue(data, WORK_LIST);
    }

    private static String names(JsonNode data) {
        var names = new ArrayList<String>();
        data.forEach(node -> names.add(node.asText()));
        return String.join(", ", names);
    }

    static String renderTable(List<WorkResponse> works) {
        if (works.isEmpty()) {
            return "No entries";
        }
        var sb = new StringBuilder(String.format("%-6s %-24s %-8s %-8s %-20s %-6s %s%n",
                "ID", "NAME", "STATUS", "ENABLED", "NEXT RUN", "RUNS", "TIMER"));
        for (var work : works) {
            sb.append(String.format("%-6d %-24s %-8s %-8s %-20s %-6d %s%n",
                    work.getId(), work.getName(), work.getStatus().getCode(), work.isEnabled() ? "yes" : "no",
                    formatTime(work.getNextExecTime()), work.getExecTimes(), describe(work.getTrigger())));
        }
        return sb.toString().stripTrailing();
    }

    static String renderDetails(List<WorkResponse> works) {
        return works.stream().map(work -> String.join("\n",
                        "Id:          " + work.getId(),
                        "Name:        " + work.getName(),
                        "Status:      " + work.getStatus().getCode(),
                        "Enabled:     " + (work.isEnabled() ? "yes" : "no"),
                        "Timer:       " + describe(work.getTrigger()),
                        "Next run:    " + formatTime(work.getNextExecTime()),
                        "Runs:        " + work.getExecTimes(),
                        "Action:      " + describe(work.getAction()),
                        "If running:  " + work.getDoIfRunning().getDescription(),
                        "Processes:   " + (work.getPids() == null || work.getPids().isEmpty() ? "-"
                                : work.getPids().stream().map(String::valueOf).collect(Collectors.joining(", ")))))
                .collect(Collectors.joining("\n\n"));
    }

    private static String formatTime(DateTime time) {
        if (time == null) {
            return "-";
        }
        return String.format("%04d-%02d-%02d %02d:%02d:%02d",
                time.getYear(), time.getMonth(), time.getDay(), time.getHour(), time.getMin(), time.getSec());
    }

    private static String describe(Trigger trigger) {
        if (!(trigger instanceof Trigger.Timed timed)) {
            return "none";
        }
        var timer = timed.timer();
        if (timer instanceof Timer.Repeat repeat) {
            return "repeat every " + describe(repeat.every());
        }
        if (timer instanceof Timer.ManyTimes manyTimes) {
            return "repeat every " + describe(manyTimes.every()) + ", " + manyTimes.times() + " times";
        }
        if (timer instanceof Timer.Once once) {
            return "once at " + formatTime(once.at());
        }
        return "never";
    }

    private static String describe(Duration duration) {
        var parts = new ArrayList<String>();
        addPart(parts, duration.getYear(), "y");
        addPart(parts, duration.getMonth(), "mo");
        addPart(parts, duration.getDay(), "d");
        addPart(parts, duration.getHour(), "h");
        addPart(parts, duration.getMin(), "m");
        addPart(parts, duration.getSec(), "s");
        if (parts.isEmpty()) {
            parts.add("0s");
        }
        return String.join(" ", parts);
    }

    private static void addPart(List<String> parts, int value, String unit) {
        if (value != 0) {
            parts.add(value + unit);
        }
    }

    private static String describe(Action action) {
        if (!(action instanceof Action.Exec exec)) {
            return "none";
        }
        var execute = exec.execute();
        var args = execute.getArgs() == null ? "" : " " + String.join(" ", execute.getArgs());
        return execute.getExecutable() + args;
    }
}
