package com.example.cronkeeper.mapper;

import com.example.cronkeeper.domain.action.SpawnedProcess;
import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.Work;
import com.example.cronkeeper.dto.WorkResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for converting works and entries to views
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface WorkMapper {

    /**
     * Convert a live Work to a WorkResponse
     */
    @Mapping(target = "id", source = "entry.id")
    @Mapping(target = "name", source = "entry.name")
    @Mapping(target = "enabled", source = "entry.enabled")
    @Mapping(target = "trigger", source = "entry.trigger")
    @Mapping(target = "action", source = "entry.action")
    @Mapping(target = "logger", source = "entry.logger")
    @Mapping(target = "doIfRunning", source = "entry.doIfRunning")
    @Mapping(target = "nextExecTime", source = "triggerState.execTime")
    @Mapping(target = "execTimes", source = "triggerState.execTimes")
    @Mapping(target = "pids", source = "runningProcesses")
    WorkResponse toResponse(Work work);

    /**
     * Convert an Entry without runtime state (disabled) to a WorkResponse
     */
    @Mapping(target = "nextExecTime", ignore = true)
    @Mapping(target = "execTimes", ignore = true)
    @Mapping(target = "pids", ignore = true)
    WorkResponse toResponse(Entry entry);

    default Long toPid(SpawnedProcess process) {
        return process.getPid();
    }
}
