package com.example.cronkeeper.controller;

import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.EntryIdentifier;
import com.example.cronkeeper.dto.ControlRequest;
import com.example.cronkeeper.dto.ControlResponse;
import com.example.cronkeeper.dto.WorkResponse;
import com.example.cronkeeper.service.EntryManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Control plane of the daemon.
 * <p>
 * Every endpoint takes a {@code {token, data}} envelope and answers with
 * {@code {code, data}}. Failures are rendered by {@code GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@Profile("daemon")
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Control Plane", description = "APIs for managing entries of the running daemon")
public class ControlPlaneController {

    private final EntryManagementService entryManagementService;

    // === Entry Changes ===

    @PostMapping("/addEntries")
    @Operation(summary = "Add entries", description = "Store new entries with daemon-assigned ids and schedule the enabled ones")
    public ResponseEntity<ControlResponse<List<String>>> addEntries(@Valid @RequestBody ControlRequest<List<Entry>> request) {
        log.info("API: Add entries request");

        var names = entryManagementService.addEntries(request.getToken(), request.getData());
        return ResponseEntity.ok(ControlResponse.success(names));
    }

    @PostMapping("/editEntry")
    @Operation(summary = "Edit an entry", description = "Replace the entry carrying the same id")
    public ResponseEntity<ControlResponse<String>> editEntry(@Valid @RequestBody ControlRequest<Entry> request) {
        log.info("API: Edit entry request");

        return ResponseEntity.ok(ControlResponse.success(entryManagementService.editEntry(request.getToken(), request.getData())));
    }

    @PostMapping("/deleteEntries")
    @Operation(summary = "Delete entries", description = "Delete the entry with an id, or every entry with a name")
    public ResponseEntity<ControlResponse<Integer>> deleteEntries(@Valid @RequestBody ControlRequest<EntryIdentifier> request) {
        log.info("API: Delete entries {}", request.getData());

        var deleted = entryManagementService.deleteEntries(request.getToken(), request.getData());
        return ResponseEntity.ok(ControlResponse.success(deleted));
    }

    // === Work Control ===

    @PostMapping("/startEntries")
    @Operation(summary = "Start entries", description = "Start the matching works now, regardless of their due time")
    public ResponseEntity<ControlResponse<String>> startEntries(@Valid @RequestBody ControlRequest<EntryIdentifier> request) {
        log.info("API: Start entries {}", request.getData());

        return ResponseEntity.ok(ControlResponse.success(entryManagementService.startEntries(request.getToken(), request.getData())));
    }

    @PostMapping("/pauseEntries")
    @Operation(summary = "Pause entries", description = "Kill the processes of the matching works and pause them")
    public ResponseEntity<ControlResponse<String>> pauseEntries(@Valid @RequestBody ControlRequest<EntryIdentifier> request) {
        log.info("API: Pause entries {}", request.getData());

        return ResponseEntity.ok(ControlResponse.success(entryManagementService.pauseEntries(request.getToken(), request.getData())));
    }

    // === Queries ===

    @PostMapping("/listEntries")
    @Operation(summary = "List entries", description = "List every entry with its runtime state")
    public ResponseEntity<ControlResponse<List<WorkResponse>>> listEntries(@Valid @RequestBody ControlRequest<Void> request) {
        return ResponseEntity.ok(ControlResponse.success(entryManagementService.listEntries(request.getToken())));
    }

    @PostMapping("/detailEntry")
    @Operation(summary = "Entry details", description = "Show the entries matching an id or name")
    public ResponseEntity<ControlResponse<List<WorkResponse>>> detailEntry(@Valid @RequestBody ControlRequest<EntryIdentifier> request) {
        return ResponseEntity.ok(ControlResponse.success(entryManagementService.detailEntry(request.getToken(), request.getData())));
    }

    // === Daemon ===

    @PostMapping("/stopDaemon")
    @Operation(summary = "Stop the daemon", description = "Stop scheduling and shut the daemon down; running jobs are left alone")
    public ResponseEntity<ControlResponse<String>> stopDaemon(@Valid @RequestBody ControlRequest<Void> request) {
        log.info("API: Stop daemon request");

        return ResponseEntity.ok(ControlResponse.success(entryManagementService.stopDaemon(request.getToken())));
    }
}
