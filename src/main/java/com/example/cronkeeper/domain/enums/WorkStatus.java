package com.example.cronkeeper.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Coarse lifecycle flag of an entry's work, independent of its trigger cursor.
 */
@Getter
@RequiredArgsConstructor
public enum WorkStatus {

    /**
     * Waiting for its next due time.
     * Initial state for new entries.
     */
    PENDING("pending", true),

    /**
     * At least one spawned process may still be alive.
     */
    RUNNING("running", true),

    /**
     * Stopped by an operator, or a one-shot job that has fired.
     * Not scheduled until started again.
     */
    PAUSED("paused", false),

    /**
     * A scheduled transition failed. Not scheduled until started again.
     */
    ERROR("error", false);

    private final String code;

    /**
     * Whether the scheduler loop considers works in this status
     */
    private final boolean schedulable;
}
