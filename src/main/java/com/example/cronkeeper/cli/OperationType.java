package com.example.cronkeeper.cli;

import com.example.cronkeeper.domain.enums.DoIfRunning;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * CLI operations and their help text.
 */
@Getter
@RequiredArgsConstructor
public enum OperationType {

    ADD("add", "Add an entry", """
            Usage: cronkeeper add [flags]
              --name <name>          Entry name (generated if missing)
              --disable              Store the entry without scheduling it
              --paused               Start the entry paused
            Timer:
              --repeat               Repeat every duration given by the field flags (one day if none)
              --times <n>            With --repeat, run at most n times
              --once                 Run once at the time given by the field flags (now plus one day if none)
              --never                Never run on a timer
              --year --month --day --hour --min --sec <n>
                                     Duration for --repeat, point in time for --once
            Execution:
              --exec <path>          Executable to run
              --args "<a b c>"       Space separated arguments
              --env "<K=V K2=V2>"    Space separated environment variables
              --dir <path>           Working directory
              --username <name>      Account to run as
            Output:
              --log-file <path>      Append output to a file
              --log-off              Discard output
            If running:
            """ + indent(DoIfRunning.help())),

    DELETE("delete", "Delete entries", """
            Usage: cronkeeper delete <id|name>
            Deletes the entry with the id, or every entry with the name.
            """),

    START("start", "Start entries now", """
            Usage: cronkeeper start <id|name>
            Starts the matching entries now, regardless of their due time.
            """),

    PAUSE("pause", "Pause entries", """
            Usage: cronkeeper pause <id|name>
            Kills the processes of the matching entries and pauses them.
            """),

    START_DAEMON("start-daemon", "Start the daemon", """
            Usage: cronkeeper start-daemon
            Runs the daemon in the foreground.
            """),

    STOP_DAEMON("stop-daemon", "Stop the daemon", """
            Usage: cronkeeper stop-daemon
            Stops the running daemon. Running jobs are left alone.
            """),

    LIST("list", "List entries", """
            Usage: cronkeeper list
            """),

    DETAIL("detail", "Show entry details", """
            Usage: cronkeeper detail <id|name>
            """),

    HELP("help", "Show help", """
            Usage: cronkeeper help
            """),

    VERSION("version", "Show the version", """
            Usage: cronkeeper version
            """);

    private final String command;
    private final String summary;
    private final String help;

    public static Optional<OperationType> fromCommand(String command) {
        return Arrays.stream(values())
                .filter(type -> type.command.equals(command))
                .findFirst();
    }

    /**
     * Overview of every operation
     */
    public static String generalHelp() {
        var sb = new StringBuilder("Usage: cronkeeper <operation> [flags]\n\nOperations:\n");
        for (var type : values()) {
            sb.append(String.format("  %-14s %s%n", type.command, type.summary));
        }
        sb.append("\nRun 'cronkeeper <operation> --help' for the flags of an operation.\n");
        return sb.toString();
    }

    private static String indent(String text) {
        return text.lines().map(line -> "  " + line).reduce("", (a, b) -> a + b + "\n");
    }
}
