package com.example.cronkeeper.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Exception for a start that the entry's timer does not allow
 */
@Getter
public class TriggerPolicyException extends WorkTransitionException {

    private final Violation violation;

    public TriggerPolicyException(String entryName, Violation violation) {
        super(entryName, String.format("Entry %s %s", entryName, violation.getDescription()));
        this.violation = violation;
    }

    @Getter
    @RequiredArgsConstructor
    public enum Violation {
        ONCE_EXECUTED_TWICE("with Once timer executed twice"),
        MANY_TIMES_EXCEEDED("with ManyTimes timer exceeded its times"),
        NEVER_FIRED("with Never timer was asked to start"),
        NO_TRIGGER("was started without a trigger");

        private final String description;
    }
}
