package com.example.cronkeeper.service;

import com.example.cronkeeper.domain.entity.DaemonConfig;
import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.EntryIdentifier;
import com.example.cronkeeper.domain.entity.Work;
import com.example.cronkeeper.domain.enums.DaemonStatus;
import com.example.cronkeeper.domain.repository.ConfigRepository;
import com.example.cronkeeper.exception.EntryNotFoundException;
import com.example.cronkeeper.util.RandomStrings;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Top-level state of the daemon: persisted config, one {@link WorkHandle} per
 * enabled entry, and the daemon status.
 * <p>
 * A single read/write lock covers this state. Structural changes are applied to
 * a copy of the config, persisted, and only then swapped in, all under the write
 * lock, so memory and disk never diverge. The lock does not cover the state inside
 * each handle.
 */
@Slf4j
@Component
@Profile("daemon")
@RequiredArgsConstructor
public class DaemonRuntime {

    private final ConfigRepository configRepository;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Long, WorkHandle> works = new LinkedHashMap<>();

    private DaemonConfig config;

    private DaemonStatus status = DaemonStatus.RUNNING;

    @PostConstruct
    public void initialize() {
        lock.writeLock().lock();
        try {
            config = configRepository.load();
            works.clear();
            for (var entry : config.getEntries()) {
                if (entry.isEnabled()) {
                    works.put(entry.getId(), new WorkHandle(Work.fromEntry(entry)));
                }
            }
            status = DaemonStatus.RUNNING;
            log.info("Loaded {} entries, {} enabled", config.getEntries().size(), works.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String token() {
        return readLocked(() -> config.getToken());
    }

    public String address() {
        return readLocked(() -> config.getAddress());
    }

    public DaemonStatus status() {
        return readLocked(() -> status);
    }

    public boolean isRunning() {
        return status() == DaemonStatus.RUNNING;
    }

    /**
     * Snapshot of the work list. The handles stay live.
     */
    public List<WorkHandle> works() {
        return readLocked(() -> List.copyOf(works.values()));
    }

    public Optional<WorkHandle> work(long entryId) {
        return readLocked(() -> Optional.ofNullable(works.get(entryId)));
    }

    public List<Entry> entries() {
        return readLocked(() -> List.copyOf(config.getEntries()));
    }

    public List<Entry> findEntries(EntryIdentifier identifier) {
        return readLocked(() -> config.findEntries(identifier));
    }

    /**
     * Add entries with ids counting up from the highest existing id. Unnamed
     * entries get a generated name.
     *
     * @return the stored entries, ids assigned
     */
    public List<Entry> addEntries(List<Entry> entries) {
        lock.writeLock().lock();
        try {
            var updated = config.copy();
            var added = new ArrayList<Entry>(entries.size());
            for (var entry : entries) {
                var named = entry.getName() == null || entry.getName().isBlank()
                        ? entry.toBuilder().name(RandomStrings.entryName()).build()
                        : entry;
                added.add(updated.addEntry(named, updated.maxEntryId() + 1));
            }

            configRepository.save(updated);
            config = updated;

            for (var entry : added) {
                if (entry.isEnabled()) {
                    works.put(entry.getId(), new WorkHandle(Work.fromEntry(entry)));
                }
                log.info("Added entry {} ({})", entry.getName(), entry.getId());
            }
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove every entry matching the identifier along with its work. The removed
     * works are returned so the caller can stop them without holding the lock.
     *
     * @throws EntryNotFoundException if nothing matches
     */
    public Deletion deleteEntries(EntryIdentifier identifier) {
        lock.writeLock().lock();
        try {
            var updated = config.copy();
            var removed = updated.deleteEntries(identifier);
            if (removed.isEmpty()) {
                throw new EntryNotFoundException(identifier.toString());
            }

            configRepository.save(updated);
            config = updated;

            var removedWorks = new ArrayList<WorkHandle>();
            for (var entry : removed) {
                Optional.ofNullable(works.remove(entry.getId())).ifPresent(removedWorks::add);
                log.info("Deleted entry {} ({})", entry.getName(), entry.getId());
            }
            return new Deletion(removed, removedWorks);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the entry with the same id. Its work is rebuilt and keeps tracking
     * its processes; disabling the entry removes the work, which is returned.
     *
     * @throws EntryNotFoundException if no entry has that id
     */
    public Optional<WorkHandle> editEntry(Entry entry) {
        lock.writeLock().lock();
        try {
            var updated = config.copy();
            updated.editEntry(entry)
                    .orElseThrow(() -> new EntryNotFoundException(new EntryIdentifier.Id(entry.getId()).toString()));

            configRepository.save(updated);
            config = updated;
            log.info("Edited entry {} ({})", entry.getName(), entry.getId());

            var existing = works.get(entry.getId());
            if (!entry.isEnabled()) {
                return Optional.ofNullable(works.remove(entry.getId()));
            }
            if (existing != null) {
                existing.replaceEntry(entry);
            } else {
                works.put(entry.getId(), new WorkHandle(Work.fromEntry(entry)));
            }
            return Optional.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Flip the status flag. In-flight transitions are not awaited.
     */
    public void stop() {
        lock.writeLock().lock();
        try {
            status = DaemonStatus.STOPPED;
            log.info("Daemon status set to {}", status);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T readLocked(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Entries removed by one delete, and the works that ran them.
     */
    public record Deletion(List<Entry> entries, List<WorkHandle> works) {
    }
}
