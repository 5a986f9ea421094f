package com.example.cronkeeper.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persisted daemon configuration: the entry list plus the control-plane
 * listen address and shared token.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DaemonConfig {

    public static final String DEFAULT_ADDRESS = "0.0.0.0:6472";

    @Builder.Default
    private List<Entry> entries = new ArrayList<>();

    private String address;

    private String token;

    /**
     * Deep enough copy to mutate the entry list without touching this instance
     */
    public DaemonConfig copy() {
        var copied = new ArrayList<Entry>(entries.size());
        for (var entry : entries) {
            copied.add(entry.toBuilder().build());
        }
        return new DaemonConfig(copied, address, token);
    }

    public long maxEntryId() {
        return entries.stream().mapToLong(Entry::getId).max().orElse(0L);
    }

    public Entry addEntry(Entry entry, long id) {
        var added = entry.toBuilder().id(id).build();
        entries.add(added);
        return added;
    }

    /**
     * Remove every entry matching the identifier.
     *
     * @return the removed entries, in list order
     */
    public List<Entry> deleteEntries(EntryIdentifier identifier) {
        var removed = new ArrayList<Entry>();
        var it = entries.iterator();
        while (it.hasNext()) {
            var entry = it.next();
            if (entry.matches(identifier)) {
                removed.add(entry);
                it.remove();
            }
        }
        return removed;
    }

    /**
     * Replace the entry carrying the same id.
     *
     * @return the replaced entry, empty if no entry has that id
     */
    public Optional<Entry> editEntry(Entry entry) {
        for (var i = 0; i < entries.size(); i++) {
            if (entries.get(i).getId() == entry.getId()) {
                return Optional.of(entries.set(i, entry));
            }
        }
        return Optional.empty();
    }

    public List<Entry> findEntries(EntryIdentifier identifier) {
        return entries.stream().filter(entry -> entry.matches(identifier)).toList();
    }
}
