package com.example.cronkeeper.domain.trigger;

import com.example.cronkeeper.domain.time.DateTime;
import com.example.cronkeeper.domain.time.Duration;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How the next due time of an entry evolves.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Timer.Repeat.class, name = "Repeat"),
        @JsonSubTypes.Type(value = Timer.Once.class, name = "Once"),
        @JsonSubTypes.Type(value = Timer.ManyTimes.class, name = "ManyTimes"),
        @JsonSubTypes.Type(value = Timer.Never.class, name = "Never")
})
public sealed interface Timer {

    /**
     * Fires every {@code every}, without limit.
     */
    record Repeat(Duration every) implements Timer {
    }

    /**
     * Fires a single time at {@code at}.
     */
    record Once(DateTime at) implements Timer {
    }

    /**
     * Fires every {@code every}, at most {@code times} times.
     */
    record ManyTimes(Duration every, int times) implements Timer {
    }

    record Never() implements Timer {
    }
}
