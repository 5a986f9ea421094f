package com.example.cronkeeper.domain.trigger;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Scheduling attached to an entry: either a {@link Timer} or nothing.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Trigger.Timed.class, name = "Timer"),
        @JsonSubTypes.Type(value = Trigger.None.class, name = "None")
})
public sealed interface Trigger {

    static Trigger timer(Timer timer) {
        return new Timed(timer);
    }

    static Trigger none() {
        return new None();
    }

    record Timed(Timer timer) implements Trigger {
    }

    record None() implements Trigger {
    }
}
