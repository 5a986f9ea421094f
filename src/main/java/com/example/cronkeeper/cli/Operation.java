package com.example.cronkeeper.cli;

import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.EntryIdentifier;

/**
 * A parsed CLI invocation.
 */
public sealed interface Operation {

    record Add(Entry entry) implements Operation {
    }

    record Delete(EntryIdentifier identifier) implements Operation {
    }

    record Start(EntryIdentifier identifier) implements Operation {
    }

    record Pause(EntryIdentifier identifier) implements Operation {
    }

    record StartDaemon() implements Operation {
    }

    record StopDaemon() implements Operation {
    }

    record ListEntries() implements Operation {
    }

    record Detail(EntryIdentifier identifier) implements Operation {
    }

    /**
     * @param topic operation to explain, null for the general help
     */
    record Help(OperationType topic) implements Operation {
    }

    record Version() implements Operation {
    }
}
