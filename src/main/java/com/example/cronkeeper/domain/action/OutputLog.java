package com.example.cronkeeper.domain.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Where the output of a spawned job goes.
 * <ul>
 *   <li>{@code File} - appended to the given path</li>
 *   <li>{@code Default} - a fresh file in the daemon's output directory</li>
 *   <li>{@code Off} - discarded</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = OutputLog.File.class, name = "File"),
        @JsonSubTypes.Type(value = OutputLog.Default.class, name = "Default"),
        @JsonSubTypes.Type(value = OutputLog.Off.class, name = "Off")
})
public sealed interface OutputLog {

    static OutputLog defaultLog() {
        return new Default();
    }

    record File(String path) implements OutputLog {
    }

    record Default() implements OutputLog {
    }

    record Off() implements OutputLog {
    }
}
