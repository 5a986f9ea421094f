package com.example.cronkeeper.cli;

import com.example.cronkeeper.domain.action.Action;
import com.example.cronkeeper.domain.action.Execute;
import com.example.cronkeeper.domain.action.OutputLog;
import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.EntryIdentifier;
import com.example.cronkeeper.domain.enums.DoIfRunning;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.domain.time.DateTime;
import com.example.cronkeeper.domain.time.Duration;
import com.example.cronkeeper.domain.trigger.Timer;
import com.example.cronkeeper.domain.trigger.Trigger;
import com.example.cronkeeper.service.user.SystemUserResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns command-line arguments into an {@link Operation}.
 * <p>
 * Flags are looked up anywhere after the operation name. A flag missing its
 * value leaves the field at its default.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperationParser {

    private static final List<String> HELP_FLAGS = List.of("--help", "-h");

    private final SystemUserResolver systemUserResolver;

    /**
     * Whether the arguments ask for help rather than an action
     */
    public static boolean wantsHelp(List<String> args) {
        return args.stream().anyMatch(HELP_FLAGS::contains);
    }

    /**
     * @param args arguments without the program name; the first one names the operation
     * @throws IllegalArgumentException on a missing or malformed entry identifier, or a
     *                                  one-shot time that does not exist
     */
    public Operation parse(List<String> args) {
        if (args.isEmpty()) {
            return new Operation.Help(null);
        }
        var type = OperationType.fromCommand(args.get(0));
        if (type.isEmpty()) {
            log.debug("Unknown operation {}", args.get(0));
            return new Operation.Help(null);
        }
        if (wantsHelp(args)) {
            return new Operation.Help(type.get());
        }

        return switch (type.get()) {
            case ADD -> new Operation.Add(parseEntry(args));
            case DELETE -> new Operation.Delete(identifier(args));
            case START -> new Operation.Start(identifier(args));
            case PAUSE -> new Operation.Pause(identifier(args));
            case START_DAEMON -> new Operation.StartDaemon();
            case STOP_DAEMON -> new Operation.StopDaemon();
            case LIST -> new Operation.ListEntries();
            case DETAIL -> new Operation.Detail(identifier(args));
            case HELP -> new Operation.Help(null);
            case VERSION -> new Operation.Version();
        };
    }

    Entry parseEntry(List<String> args) {
        return Entry.builder()
                .name(value(args, "--name").orElse(null))
                .enabled(!args.contains("--disable"))
                .status(args.contains("--paused") ? WorkStatus.PAUSED : WorkStatus.PENDING)
                .trigger(parseTrigger(args))
                .logger(parseLogger(args))
                .action(parseAction(args))
                .doIfRunning(parseDoIfRunning(args))
                .build();
    }

    /**
     * The last timer flag wins. No timer flag means no trigger.
     */
    Trigger parseTrigger(List<String> args) {
        Timer timer = null;
        for (var arg : args) {
            switch (arg) {
                case "--repeat" -> {
                    var every = parseDuration(args).orElseGet(Duration::oneDay);
                    var times = intValue(args, "--times");
                    timer = times.isPresent() ? new Timer.ManyTimes(every, times.get()) : new Timer.Repeat(every);
                }
                case "--once" -> timer = new Timer.Once(parseDateTime(args).orElseGet(DateTime::oneDay));
                case "--never" -> timer = new Timer.Never();
                default -> {
                }
            }
        }
        return timer == null ? Trigger.none() : Trigger.timer(timer);
    }

    /**
     * @return empty when no field flag is given
     */
    Optional<Duration> parseDuration(List<String> args) {
        if (!hasFieldFlag(args)) {
            return Optional.empty();
        }
        return Optional.of(Duration.of(
                intValue(args, "--year").orElse(0),
                intValue(args, "--month").orElse(0),
                intValue(args, "--day").orElse(0),
                intValue(args, "--hour").orElse(0),
                intValue(args, "--min").orElse(0),
                intValue(args, "--sec").orElse(0)));
    }

    /**
     * Missing date fields default to today, missing time fields to zero.
     *
     * @return empty when no field flag is given
     * @throws IllegalArgumentException if the fields name no existing local time
     */
    Optional<DateTime> parseDateTime(List<String> args) {
        if (!hasFieldFlag(args)) {
            return Optional.empty();
        }
        var today = LocalDate.now();
        var year = intValue(args, "--year").orElse(today.getYear());
        var month = intValue(args, "--month").orElse(today.getMonthValue());
        var day = intValue(args, "--day").orElse(today.getDayOfMonth());
        var hour = intValue(args, "--hour").orElse(0);
        var min = intValue(args, "--min").orElse(0);
        var sec = intValue(args, "--sec").orElse(0);

        var dateTime = DateTime.of(year, month, day, hour, min, sec)
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                        "Time %04d-%02d-%02d %02d:%02d:%02d does not exist", year, month, day, hour, min, sec)));
        return Optional.of(dateTime);
    }

    OutputLog parseLogger(List<String> args) {
        OutputLog logger = OutputLog.defaultLog();
        for (var i = 0; i < args.size(); i++) {
            switch (args.get(i)) {
                case "--log-file" -> logger = valueAt(args, i + 1)
                        .<OutputLog>map(OutputLog.File::new)
                        .orElseGet(OutputLog.Off::new);
                case "--log-off" -> logger = new OutputLog.Off();
                default -> {
                }
            }
        }
        return logger;
    }

    Action parseAction(List<String> args) {
        var executable = value(args, "--exec");
        if (executable.isEmpty()) {
            return Action.none();
        }

        var execute = Execute.builder()
                .executable(executable.get())
                .args(value(args, "--args").map(text -> List.of(text.split(" "))).orElse(null))
                .env(value(args, "--env").map(OperationParser::parseEnv).orElse(null))
                .workingDir(value(args, "--dir").orElse(null))
                .user(value(args, "--username").flatMap(systemUserResolver::resolve).orElse(null))
                .build();
        return Action.exec(execute);
    }

    DoIfRunning parseDoIfRunning(List<String> args) {
        var policy = DoIfRunning.START_NEW;
        for (var arg : args) {
            policy = DoIfRunning.fromFlag(arg).orElse(policy);
        }
        return policy;
    }

    private static Map<String, String> parseEnv(String text) {
        var env = new LinkedHashMap<String, String>();
        Arrays.stream(text.trim().split("\\s+"))
                .filter(pair -> pair.indexOf('=') > 0)
                .forEach(pair -> {
                    var separator = pair.indexOf('=');
                    env.put(pair.substring(0, separator), pair.substring(separator + 1));
                });
        return env;
    }

    private static EntryIdentifier identifier(List<String> args) {
        return EntryIdentifier.parse(args.size() > 1 ? args.get(1) : null);
    }

    private static boolean hasFieldFlag(List<String> args) {
        return List.of("--year", "--month", "--day", "--hour", "--min", "--sec").stream()
                .anyMatch(flag -> intValue(args, flag).isPresent());
    }

    private static Optional<Integer> intValue(List<String> args, String flag) {
        return value(args, flag).flatMap(text -> {
            try {
                return Optional.of(Integer.parseInt(text));
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric value {} for {}", text, flag);
                return Optional.empty();
            }
        });
    }

    private static Optional<String> value(List<String> args, String flag) {
        var index = args.indexOf(flag);
        return index < 0 ? Optional.empty() : valueAt(args, index + 1);
    }

    private static Optional<String> valueAt(List<String> args, int index) {
        if (index >= args.size() || args.get(index).startsWith("--")) {
            return Optional.empty();
        }
        return Optional.of(args.get(index));
    }
}
