package com.example.cronkeeper.service;

import com.example.cronkeeper.domain.action.ProcessLauncher;
import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.EntryIdentifier;
import com.example.cronkeeper.dto.WorkResponse;
import com.example.cronkeeper.exception.EntryNotFoundException;
import com.example.cronkeeper.exception.InvalidTokenException;
import com.example.cronkeeper.exception.WorkTransitionException;
import com.example.cronkeeper.mapper.WorkMapper;
import com.example.cronkeeper.service.event.DaemonStopRequestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Service behind the control plane.
 * <p>
 * Provides:
 * - Token check before any state is read or changed
 * - Adding, editing and deleting entries
 * - Starting and pausing works on demand
 * - Listing entries with their runtime state
 * - Stopping the daemon
 */
@Slf4j
@Service
@Profile("daemon")
@RequiredArgsConstructor
public class EntryManagementService {

    private final DaemonRuntime daemonRuntime;
    private final ProcessLauncher processLauncher;
    private final WorkMapper workMapper;
    private final ApplicationEventPublisher eventPublisher;

    // === Entry Changes ===

    /**
     * Add entries, persisted before returning.
     *
     * @return names of the stored entries, generated where none was given
     */
    public List<String> addEntries(String token, List<Entry> entries) {
        authorize(token);
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("No entry given");
        }
        log.info("Adding {} entr(ies)", entries.size());

        return daemonRuntime.addEntries(entries).stream().map(Entry::getName).toList();
    }

    public String editEntry(String token, Entry entry) {
        authorize(token);
        if (entry == null) {
            throw new IllegalArgumentException("No entry given");
        }

        daemonRuntime.editEntry(entry).ifPresent(removed -> stopQuietly(removed, "disabled"));
        return String.format("Entry %s (%d) updated", entry.getName(), entry.getId());
    }

    /**
     * Delete every matching entry and stop its processes, best effort.
     *
     * @return number of entries deleted
     */
    public int deleteEntries(String token, EntryIdentifier identifier) {
        authorize(token);
        requireIdentifier(identifier);

        var deletion = daemonRuntime.deleteEntries(identifier);
        deletion.works().forEach(handle -> stopQuietly(handle, "deleted"));
        return deletion.entries().size();
    }

    // === Work Control ===

    /**
     * Start every matching work now, regardless of its due time.
     */
    public String startEntries(String token, EntryIdentifier identifier) {
        authorize(token);
        requireIdentifier(identifier);

        var handles = findWorks(identifier);
        applyToAll(handles, WorkHandle::start);
        return String.format("Started %d work(s)", handles.size());
    }

    /**
     * Stop every matching work. Stopped works are paused until started again.
     */
    public String pauseEntries(String token, EntryIdentifier identifier) {
        authorize(token);
        requireIdentifier(identifier);

        var handles = findWorks(identifier);
        applyToAll(handles, WorkHandle::stop);
        return String.format("Paused %d work(s)", handles.size());
    }

    // === Queries ===

    public List<WorkResponse> listEntries(String token) {
        authorize(token);
        return daemonRuntime.entries().stream().map(this::toResponse).toList();
    }

    public List<WorkResponse> detailEntry(String token, EntryIdentifier identifier) {
        authorize(token);
        requireIdentifier(identifier);

        var entries = daemonRuntime.findEntries(identifier);
        if (entries.isEmpty()) {
            throw new EntryNotFoundException(identifier.toString());
        }
        return entries.stream().map(this::toResponse).toList();
    }

    // === Daemon ===

    public String stopDaemon(String token) {
        authorize(token);

        daemonRuntime.stop();
        eventPublisher.publishEvent(new DaemonStopRequestedEvent(this));
        return "Daemon stopping";
    }

    private void authorize(String token) {
        if (token == null || !token.equals(daemonRuntime.token())) {
            log.warn("Rejected control-plane request with an invalid token");
            throw new InvalidTokenException();
        }
    }

    private void requireIdentifier(EntryIdentifier identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("No entry identifier given");
        }
    }

    private List<WorkHandle> findWorks(EntryIdentifier identifier) {
        var entries = daemonRuntime.findEntries(identifier);
        if (entries.isEmpty()) {
            throw new EntryNotFoundException(identifier.toString());
        }

        var handles = new ArrayList<WorkHandle>();
        for (var entry : entries) {
            daemonRuntime.work(entry.getId()).ifPresent(handles::add);
        }
        if (handles.isEmpty()) {
            throw new IllegalStateException("Entry " + identifier + " is disabled");
        }
        return handles;
    }

    /**
     * Apply a transition to every handle, even after one fails. Failures are
     * reported together.
     */
    private void applyToAll(List<WorkHandle> handles, BiConsumer<WorkHandle, ProcessLauncher> transition) {
        var failures = new ArrayList<WorkTransitionException>();
        for (var handle : handles) {
            try {
                transition.accept(handle, processLauncher);
            } catch (WorkTransitionException e) {
                log.error("Entry {} ({}): {}", handle.entryName(), handle.getEntryId(), e.getMessage());
                failures.add(e);
            }
        }

        if (failures.size() == 1) {
            throw failures.get(0);
        }
        if (!failures.isEmpty()) {
            var message = String.join("; ", failures.stream().map(Throwable::getMessage).toList());
            var aggregate = new WorkTransitionException(failures.get(0).getEntryName(), message);
            failures.forEach(aggregate::addSuppressed);
            throw aggregate;
        }
    }

    private void stopQuietly(WorkHandle handle, String reason) {
        try {
            handle.stop(processLauncher);
        } catch (WorkTransitionException e) {
            log.error("Entry {} ({}) {}, but its processes could not all be stopped: {}",
                    handle.entryName(), handle.getEntryId(), reason, e.getMessage());
        }
    }

    private WorkResponse toResponse(Entry entry) {
        return daemonRuntime.work(entry.getId())
                .map(handle -> handle.read(workMapper::toResponse))
                .orElseGet(() -> workMapper.toResponse(entry));
    }
}
