package com.example.cronkeeper.dto;

import com.example.cronkeeper.domain.action.Action;
import com.example.cronkeeper.domain.action.OutputLog;
import com.example.cronkeeper.domain.enums.DoIfRunning;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.domain.time.DateTime;
import com.example.cronkeeper.domain.trigger.Trigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * View of an entry and, when enabled, its runtime state
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkResponse {

    private long id;
    private String name;
    private WorkStatus status;
    private boolean enabled;
    private Trigger trigger;
    private Action action;
    private OutputLog logger;
    private DoIfRunning doIfRunning;

    /**
     * Next due time, null when the work is never due or the entry is disabled
     */
    private DateTime nextExecTime;
    private int execTimes;
    private List<Long> pids;
}
