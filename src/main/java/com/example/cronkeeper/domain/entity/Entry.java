package com.example.cronkeeper.domain.entity;

import com.example.cronkeeper.domain.action.Action;
import com.example.cronkeeper.domain.action.OutputLog;
import com.example.cronkeeper.domain.enums.DoIfRunning;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.domain.trigger.Trigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted definition of a schedulable job.
 * <p>
 * {@code id} is assigned by the daemon when the entry is added and never changes;
 * every other field may be replaced through an edit.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Entry {

    private long id;

    private String name;

    @Builder.Default
    private Action action = Action.none();

    /**
     * Destination of the spawned process output
     */
    @Builder.Default
    private OutputLog logger = OutputLog.defaultLog();

    @Builder.Default
    private Trigger trigger = Trigger.none();

    /**
     * Status the work starts in when the daemon loads this entry
     */
    @Builder.Default
    private WorkStatus status = WorkStatus.PENDING;

    @Builder.Default
    private DoIfRunning doIfRunning = DoIfRunning.START_NEW;

    @Builder.Default
    private boolean enabled = true;

    public boolean matches(EntryIdentifier identifier) {
        if (identifier instanceof EntryIdentifier.Id byId) {
            return id == byId.id();
        }
        if (identifier instanceof EntryIdentifier.Name byName) {
            return byName.name().equals(name);
        }
        throw new IllegalArgumentException("Unknown entry identifier: " + identifier);
    }
}
