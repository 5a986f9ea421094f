package com.example.cronkeeper.domain.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What an entry does when it fires.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Action.Exec.class, name = "Exec"),
        @JsonSubTypes.Type(value = Action.None.class, name = "None")
})
public sealed interface Action {

    static Action exec(Execute execute) {
        return new Exec(execute);
    }

    static Action none() {
        return new None();
    }

    record Exec(Execute execute) implements Action {
    }

    record None() implements Action {
    }
}
