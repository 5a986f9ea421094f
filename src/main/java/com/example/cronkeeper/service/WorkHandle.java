package com.example.cronkeeper.service;

import com.example.cronkeeper.domain.action.Execute;
import com.example.cronkeeper.domain.action.OutputLog;
import com.example.cronkeeper.domain.action.ProcessLauncher;
import com.example.cronkeeper.domain.action.SpawnedProcess;
import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.Work;
import com.example.cronkeeper.domain.enums.DoIfRunning;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.exception.ProcessSignalException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Independently lockable cell holding one {@link Work}.
 * <p>
 * The read/write lock guards the work's state and is only held for in-memory
 * reads and updates. The transition lock serializes {@code start}, {@code stop}
 * and {@code restart} of this work and is the only lock held while processes are
 * spawned or killed, so checking other works never waits on a slow OS call.
 */
@Slf4j
public class WorkHandle {

    @Getter
    private final long entryId;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock transitionLock = new ReentrantLock();

    private Work work;

    public WorkHandle(Work work) {
        this.entryId = work.getEntry().getId();
        this.work = work;
    }

    public <T> T read(Function<Work, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(work);
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Function<Work, T> writer) {
        lock.writeLock().lock();
        try {
            return writer.apply(work);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void update(Consumer<Work> writer) {
        write(w -> {
            writer.accept(w);
            return null;
        });
    }

    public String entryName() {
        return read(w -> w.getEntry().getName());
    }

    public WorkStatus status() {
        return read(Work::getStatus);
    }

    public boolean isDue(Instant now) {
        return read(w -> w.isDue(now));
    }

    public void start(ProcessLauncher launcher) {
        transitionLock.lock();
        try {
            doStart(launcher);
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Fire the work from the scheduler loop. Whether it is still due at
     * {@code now} is checked under the transition lock, so a work paused or
     * stopped since it was selected is left alone. A work that is still running
     * gets its {@link DoIfRunning} policy instead of a plain start.
     *
     * @return what the firing did
     */
    public Firing fire(ProcessLauncher launcher, Instant now) {
        transitionLock.lock();
        try {
            var check = read(w -> new FireCheck(w.isDue(now), w.getStatus(), w.getEntry().getDoIfRunning()));
            if (!check.due()) {
                return Firing.NOT_DUE;
            }
            if (check.status() != WorkStatus.RUNNING) {
                doStart(launcher);
                return Firing.STARTED;
            }
            return switch (check.policy()) {
                case START_NEW -> {
                    doStart(launcher);
                    yield Firing.STARTED_ANOTHER;
                }
                case STOP -> {
                    doStop(launcher);
                    yield Firing.STOPPED;
                }
                case RESTART -> {
                    doStop(launcher);
                    doStart(launcher);
                    yield Firing.RESTARTED;
                }
                case CONTINUE -> {
                    var skipped = write(w -> w.skipMissedFirings(now));
                    log.debug("Entry {} ({}) still running, skipped {} firing(s)", entryName(), entryId, skipped);
                    yield Firing.SKIPPED;
                }
            };
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Kill every tracked process, best effort. Killed processes and processes that
     * are already gone are forgotten even when another kill fails.
     *
     * @throws ProcessSignalException carrying every failed pid
     */
    public void stop(ProcessLauncher launcher) {
        transitionLock.lock();
        try {
            doStop(launcher);
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Stop, then start. A failed stop skips the start.
     */
    public void restart(ProcessLauncher launcher) {
        transitionLock.lock();
        try {
            doStop(launcher);
            doStart(launcher);
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Forget tracked processes that have exited. Works in the middle of a
     * transition are left alone.
     *
     * @return number of processes forgotten
     */
    public int reapExited(ProcessLauncher launcher) {
        if (!transitionLock.tryLock()) {
            return 0;
        }
        try {
            var tracked = read(w -> List.copyOf(w.getRunningProcesses()));
            var exited = tracked.stream().filter(process -> !launcher.isAlive(process)).toList();
            var forgotten = write(w -> w.forgetExited(exited));
            if (forgotten > 0) {
                log.debug("Entry {} ({}): {} process(es) exited", entryName(), entryId, forgotten);
            }
            return forgotten;
        } finally {
            transitionLock.unlock();
        }
    }

    public void markError() {
        update(w -> w.setStatus(WorkStatus.ERROR));
    }

    /**
     * Swap in a work rebuilt from an edited entry. Tracked processes carry over.
     */
    public void replaceEntry(Entry entry) {
        transitionLock.lock();
        try {
            lock.writeLock().lock();
            try {
                var replacement = Work.fromEntry(entry);
                replacement.getRunningProcesses().addAll(work.getRunningProcesses());
                work = replacement;
            } finally {
                lock.writeLock().unlock();
            }
        } finally {
            transitionLock.unlock();
        }
    }

    private void doStart(ProcessLauncher launcher) {
        var name = entryName();
        var prepared = write(w -> w.prepareStart()
                .map(execute -> new PreparedStart(execute, w.getEntry().getLogger())));
        if (prepared.isEmpty()) {
            log.debug("Entry {} ({}) has no action to start", name, entryId);
            return;
        }

        var spawned = launcher.spawn(name, prepared.get().execute(), prepared.get().output());
        update(w -> w.recordStart(spawned));
        log.info("Started entry {} ({}), pid {}", name, entryId, spawned.getPid());
    }

    private void doStop(ProcessLauncher launcher) {
        var name = entryName();
        var targets = write(Work::prepareStop);
        if (targets.isEmpty()) {
            log.debug("Entry {} ({}) has no action to stop", name, entryId);
            return;
        }

        var forgotten = new ArrayList<SpawnedProcess>();
        var failures = new ArrayList<ProcessSignalException>();
        for (var process : targets.get()) {
            try {
                launcher.kill(name, process);
                forgotten.add(process);
            } catch (ProcessSignalException e) {
                log.error("Entry {} ({}): {}", name, entryId, e.getMessage());
                failures.add(e);
                if (!launcher.isAlive(process)) {
                    forgotten.add(process);
                }
            }
        }
        update(w -> w.recordStop(forgotten));
        log.info("Stopped entry {} ({}), {} process(es) killed", name, entryId, targets.get().size() - failures.size());

        if (failures.size() == 1) {
            throw failures.get(0);
        }
        if (!failures.isEmpty()) {
            throw new ProcessSignalException(name, failures);
        }
    }

    /**
     * Outcome of {@link #fire}. {@code policy} is the running policy applied, null
     * when the work was idle or no longer due.
     */
    @Getter
    @RequiredArgsConstructor
    public enum Firing {
        NOT_DUE(null, false),
        STARTED(null, true),
        STARTED_ANOTHER(DoIfRunning.START_NEW, true),
        STOPPED(DoIfRunning.STOP, false),
        RESTARTED(DoIfRunning.RESTART, true),
        SKIPPED(DoIfRunning.CONTINUE, false);

        private final DoIfRunning policy;
        private final boolean spawning;
    }

    private record FireCheck(boolean due, WorkStatus status, DoIfRunning policy) {
    }

    private record PreparedStart(Execute execute, OutputLog output) {
    }
}
