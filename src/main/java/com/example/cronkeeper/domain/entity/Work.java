package com.example.cronkeeper.domain.entity;

import com.example.cronkeeper.domain.action.Action;
import com.example.cronkeeper.domain.action.Execute;
import com.example.cronkeeper.domain.action.SpawnedProcess;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.domain.time.DateTime;
import com.example.cronkeeper.domain.time.Duration;
import com.example.cronkeeper.domain.trigger.Timer;
import com.example.cronkeeper.domain.trigger.Trigger;
import com.example.cronkeeper.domain.trigger.TriggerState;
import com.example.cronkeeper.exception.InvalidTimeException;
import com.example.cronkeeper.exception.TriggerPolicyException;
import com.example.cronkeeper.exception.TriggerPolicyException.Violation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * In-memory runtime instance of an enabled {@link Entry}.
 * <p>
 * Transitions are split in two phases so the caller can spawn or kill processes
 * between them without holding the work's lock:
 * <ul>
 *   <li>{@link #prepareStart()} checks the timer policy, advances the trigger
 *       cursor and returns what to spawn; {@link #recordStart(SpawnedProcess)}
 *       tracks the spawned process.</li>
 *   <li>{@link #prepareStop()} returns the processes to kill;
 *       {@link #recordStop(Collection)} forgets them and pauses the work.</li>
 * </ul>
 * Not thread-safe; see {@code WorkHandle}.
 */
@Slf4j
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Work {

    private WorkStatus status;

    private Entry entry;

    private TriggerState triggerState;

    @Builder.Default
    private List<SpawnedProcess> runningProcesses = new ArrayList<>();

    public static Work fromEntry(Entry entry) {
        return fromEntry(entry, DateTime.now());
    }

    public static Work fromEntry(Entry entry, DateTime now) {
        return Work.builder()
                .status(entry.getStatus())
                .entry(entry)
                .triggerState(TriggerState.fromEntry(entry, now))
                .build();
    }

    /**
     * Whether the scheduler loop should fire this work at {@code now}
     */
    public boolean isDue(Instant now) {
        var execTime = triggerState.getExecTime();
        return status.isSchedulable() && execTime != null && execTime.isUp(now);
    }

    /**
     * First phase of {@code start}.
     *
     * @return the process to spawn, empty when the action is {@code None}
     * @throws TriggerPolicyException if the timer does not allow another run
     * @throws InvalidTimeException   if the next due time cannot be computed
     */
    public Optional<Execute> prepareStart() {
        if (!(entry.getAction() instanceof Action.Exec exec)) {
            return Optional.empty();
        }
        if (!(entry.getTrigger() instanceof Trigger.Timed timed)) {
            log.error("Entry {} ({}) fired without a trigger", entry.getName(), entry.getId());
            throw new TriggerPolicyException(entry.getName(), Violation.NO_TRIGGER);
        }

        var timer = timed.timer();
        if (timer instanceof Timer.Repeat repeat) {
            advance(repeat.every());
        } else if (timer instanceof Timer.ManyTimes manyTimes) {
            if (triggerState.getExecTimes() >= manyTimes.times()) {
                throw new TriggerPolicyException(entry.getName(), Violation.MANY_TIMES_EXCEEDED);
            }
            advance(manyTimes.every());
        } else if (timer instanceof Timer.Once) {
            if (triggerState.getExecTimes() >= 1) {
                throw new TriggerPolicyException(entry.getName(), Violation.ONCE_EXECUTED_TWICE);
            }
            triggerState.setExecTimes(triggerState.getExecTimes() + 1);
            status = WorkStatus.PAUSED;
        } else if (timer instanceof Timer.Never) {
            throw new TriggerPolicyException(entry.getName(), Violation.NEVER_FIRED);
        } else {
            throw new IllegalStateException("Unknown timer: " + timer);
        }
        return Optional.of(exec.execute());
    }

    /**
     * Second phase of {@code start}, after a successful spawn. A one-shot work
     * stays paused.
     */
    public void recordStart(SpawnedProcess process) {
        runningProcesses.add(process);
        if (!isOneShot()) {
            status = WorkStatus.RUNNING;
        }
    }

    /**
     * First phase of {@code stop}.
     *
     * @return the processes to kill, empty when the action is {@code None}
     */
    public Optional<List<SpawnedProcess>> prepareStop() {
        if (!(entry.getAction() instanceof Action.Exec)) {
            return Optional.empty();
        }
        return Optional.of(List.copyOf(runningProcesses));
    }

    /**
     * Second phase of {@code stop}: forget the given processes and pause.
     */
    public void recordStop(Collection<SpawnedProcess> stopped) {
        runningProcesses.removeAll(stopped);
        status = WorkStatus.PAUSED;
    }

    /**
     * Let a due firing pass without running it: the cursor moves past every slot
     * that is already up at {@code now}. The run counter is not touched.
     *
     * @return number of slots skipped
     * @throws InvalidTimeException if the next due time cannot be computed
     */
    public int skipMissedFirings(Instant now) {
        var every = period();
        if (every.isEmpty() || triggerState.getExecTime() == null) {
            return 0;
        }
        var skipped = 0;
        var current = triggerState.getExecTime();
        while (current.isUp(now)) {
            var from = current;
            var next = current.plus(every.get())
                    .orElseThrow(() -> new InvalidTimeException(entry.getName(), "cannot add " + every.get() + " to " + from));
            if (next.getTimestamp() <= current.getTimestamp()) {
                throw new InvalidTimeException(entry.getName(), "period " + every.get() + " does not advance " + current);
            }
            current = next;
            skipped++;
        }
        triggerState.setExecTime(current);
        return skipped;
    }

    /**
     * Forget processes that have exited. A running work left without live
     * processes goes back to pending.
     *
     * @return number of processes forgotten
     */
    public int forgetExited(Collection<SpawnedProcess> exited) {
        var before = runningProcesses.size();
        runningProcesses.removeAll(exited);
        if (status == WorkStatus.RUNNING && runningProcesses.isEmpty()) {
            status = WorkStatus.PENDING;
        }
        return before - runningProcesses.size();
    }

    private void advance(Duration every) {
        var current = triggerState.getExecTime();
        if (current == null) {
            throw new InvalidTimeException(entry.getName(), "work has no due time to advance");
        }
        var next = current.plus(every)
                .orElseThrow(() -> new InvalidTimeException(entry.getName(), "cannot add " + every + " to " + current));
        triggerState.setExecTime(next);
        triggerState.setExecTimes(triggerState.getExecTimes() + 1);
    }

    private Optional<Duration> period() {
        if (entry.getTrigger() instanceof Trigger.Timed timed) {
            if (timed.timer() instanceof Timer.Repeat repeat) {
                return Optional.of(repeat.every());
            }
            if (timed.timer() instanceof Timer.ManyTimes manyTimes) {
                return Optional.of(manyTimes.every());
            }
        }
        return Optional.empty();
    }

    private boolean isOneShot() {
        return entry.getTrigger() instanceof Trigger.Timed timed && timed.timer() instanceof Timer.Once;
    }
}
