package com.example.cronkeeper.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Policy applied when a work becomes due while its previous run is still going.
 */
@Getter
@RequiredArgsConstructor
public enum DoIfRunning {

    START_NEW("--stne-ir", "Start new if work is running"),

    STOP("--stop-ir", "Stop if work is running"),

    RESTART("--rest-ir", "Restart if work is running"),

    CONTINUE("--cont-ir", "Continue if work is running");

    private final String flag;
    private final String description;

    public static Optional<DoIfRunning> fromFlag(String flag) {
        return Arrays.stream(values())
                .filter(policy -> policy.flag.equals(flag))
                .findFirst();
    }

    public static String help() {
        var sb = new StringBuilder();
        for (var policy : values()) {
            sb.append(policy.flag).append(": ").append(policy.description).append('\n');
        }
        return sb.toString();
    }
}
