package com.example.cronkeeper.service;

import com.example.cronkeeper.domain.action.Action;
import com.example.cronkeeper.domain.action.Execute;
import com.example.cronkeeper.domain.action.ProcessLauncher;
import com.example.cronkeeper.domain.action.SpawnedProcess;
import com.example.cronkeeper.domain.entity.DaemonConfig;
import com.example.cronkeeper.domain.entity.Entry;
import com.example.cronkeeper.domain.entity.EntryIdentifier;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.domain.repository.ConfigRepository;
import com.example.cronkeeper.domain.time.Duration;
import com.example.cronkeeper.domain.trigger.Timer;
import com.example.cronkeeper.domain.trigger.Trigger;
import com.example.cronkeeper.dto.WorkResponse;
import com.example.cronkeeper.exception.EntryNotFoundException;
import com.example.cronkeeper.exception.InvalidTokenException;
import com.example.cronkeeper.exception.ProcessSignalException;
import com.example.cronkeeper.exception.ProcessSpawnException;
import com.example.cronkeeper.mapper.WorkMapper;
import com.example.cronkeeper.service.event.DaemonStopRequestedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntryManagementService Tests")
class EntryManagementServiceTest {

    private static final String TOKEN = "secret";

    @Mock
    private ConfigRepository configRepository;

    @Mock
    private ProcessLauncher processLauncher;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private DaemonRuntime daemonRuntime;

    private EntryManagementService entryManagementService;

    private Entry backup;

    @BeforeEach
    void setUp() {
        backup = Entry.builder()
                .id(3)
                .name("backup")
                .action(Action.exec(Execute.builder().executable("/usr/bin/rsync").build()))
                .trigger(Trigger.timer(new Timer.Repeat(Duration.oneDay())))
                .build();
        var archive = Entry.builder().id(7).name("archive").enabled(false).build();

        var entries = new ArrayList<Entry>(List.of(backup, archive));
        when(configRepository.load()).thenReturn(new DaemonConfig(entries, DaemonConfig.DEFAULT_ADDRESS, TOKEN));

        daemonRuntime = new DaemonRuntime(configRepository);
        daemonRuntime.initialize();
        entryManagementService = new EntryManagementService(
                daemonRuntime, processLauncher, Mappers.getMapper(WorkMapper.class), eventPublisher);
    }

    private void track(long entryId, SpawnedProcess process) {
        daemonRuntime.work(entryId).orElseThrow().update(w -> w.recordStart(process));
    }

    @Nested
    @DisplayName("Token Tests")
    class TokenTests {

        @Test
        @DisplayName("Should reject a wrong token without changing anything")
        void shouldRejectWrongToken() {
            var entry = Entry.builder().name("intruder").build();

            assertThatThrownBy(() -> entryManagementService.addEntries("guess", List.of(entry)))
                    .isInstanceOf(InvalidTokenException.class);

            verify(configRepository, never()).save(any());
            assertThat(daemonRuntime.entries()).hasSize(2);
        }

        @Test
        @DisplayName("Should reject a missing token")
        void shouldRejectMissingToken() {
            assertThatThrownBy(() -> entryManagementService.listEntries(null))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("Should check the token before the identifier")
        void shouldCheckTokenFirst() {
            assertThatThrownBy(() -> entryManagementService.deleteEntries("guess", new EntryIdentifier.Id(42)))
                    .isInstanceOf(InvalidTokenException.class);
        }
    }

    @Nested
    @DisplayName("addEntries Tests")
    class AddEntriesTests {

        @Test
        @DisplayName("Should return the stored names")
        void shouldReturnNames() {
            var names = entryManagementService.addEntries(TOKEN, List.of(
                    Entry.builder().name("report").build(),
                    Entry.builder().build()));

            assertThat(names).hasSize(2);
            assertThat(names.get(0)).isEqualTo("report");
            assertThat(names.get(1)).isNotBlank();
            verify(configRepository).save(any());
            assertThat(daemonRuntime.findEntries(new EntryIdentifier.Name("report")))
                    .extracting(Entry::getId)
                    .containsExactly(8L);
        }

        @Test
        @DisplayName("Should store a disabled entry without a work")
        void shouldNotScheduleDisabledEntry() {
            entryManagementService.addEntries(TOKEN, List.of(Entry.builder().name("later").enabled(false).build()));

            assertThat(daemonRuntime.work(8)).isEmpty();
            assertThat(daemonRuntime.entries()).hasSize(3);
        }

        @Test
        @DisplayName("Should reject an empty request")
        void shouldRejectEmpty() {
            assertThatThrownBy(() -> entryManagementService.addEntries(TOKEN, List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("editEntry Tests")
    class EditEntryTests {

        @Test
        @DisplayName("Should stop the processes of an entry that gets disabled")
        void shouldStopDisabledWork() {
            var process = new SpawnedProcess(100L, null);
            track(3, process);

            var message = entryManagementService.editEntry(TOKEN, backup.toBuilder().enabled(false).build());

            assertThat(message).contains("backup");
            verify(processLauncher).kill("backup", process);
            assertThat(daemonRuntime.work(3)).isEmpty();
        }

        @Test
        @DisplayName("Should keep the work of an entry that stays enabled")
        void shouldKeepEnabledWork() {
            entryManagementService.editEntry(TOKEN, backup.toBuilder().name("nightly").build());

            assertThat(daemonRuntime.work(3)).get().extracting(WorkHandle::entryName).isEqualTo("nightly");
            verifyNoInteractions(processLauncher);
        }
    }

    @Nested
    @DisplayName("deleteEntries Tests")
    class DeleteEntriesTests {

        @Test
        @DisplayName("Should delete and stop a running entry")
        void shouldDeleteAndStop() {
            var process = new SpawnedProcess(100L, null);
            track(3, process);

            var deleted = entryManagementService.deleteEntries(TOKEN, new EntryIdentifier.Name("backup"));

            assertThat(deleted).isEqualTo(1);
            verify(processLauncher).kill("backup", process);
            assertThat(daemonRuntime.works()).isEmpty();
        }

        @Test
        @DisplayName("Should still delete when a process cannot be killed")
        void shouldDeleteEvenIfKillFails() {
            var process = new SpawnedProcess(100L, null);
            track(3, process);
            doThrow(new ProcessSignalException("backup", 100L, "refused")).when(processLauncher).kill("backup", process);
            when(processLauncher.isAlive(process)).thenReturn(true);

            var deleted = entryManagementService.deleteEntries(TOKEN, new EntryIdentifier.Id(3));

            assertThat(deleted).isEqualTo(1);
            assertThat(daemonRuntime.entries()).extracting(Entry::getId).containsExactly(7L);
        }

        @Test
        @DisplayName("Should throw for an unknown entry")
        void shouldThrowForUnknown() {
            assertThatThrownBy(() -> entryManagementService.deleteEntries(TOKEN, new EntryIdentifier.Name("ghost")))
                    .isInstanceOf(EntryNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("startEntries / pauseEntries Tests")
    class WorkControlTests {

        @Test
        @DisplayName("Should start a work immediately")
        void shouldStart() {
            when(processLauncher.spawn(any(), any(), any())).thenReturn(new SpawnedProcess(100L, null));

            var message = entryManagementService.startEntries(TOKEN, new EntryIdentifier.Id(3));

            assertThat(message).isEqualTo("Started 1 work(s)");
            assertThat(daemonRuntime.work(3)).get().extracting(WorkHandle::status).isEqualTo(WorkStatus.RUNNING);
        }

        @Test
        @DisplayName("Should propagate a spawn failure")
        void shouldPropagateSpawnFailure() {
            when(processLauncher.spawn(any(), any(), any()))
                    .thenThrow(new ProcessSpawnException("backup", "/usr/bin/rsync", new IOException("not found")));

            assertThatThrownBy(() -> entryManagementService.startEntries(TOKEN, new EntryIdentifier.Id(3)))
                    .isInstanceOf(ProcessSpawnException.class);
        }

        @Test
        @DisplayName("Should refuse to start a disabled entry")
        void shouldRefuseDisabled() {
            assertThatThrownBy(() -> entryManagementService.startEntries(TOKEN, new EntryIdentifier.Name("archive")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("disabled");
        }

        @Test
        @DisplayName("Should kill processes and pause the work")
        void shouldPause() {
            var process = new SpawnedProcess(100L, null);
            track(3, process);

            var message = entryManagementService.pauseEntries(TOKEN, new EntryIdentifier.Id(3));

            assertThat(message).isEqualTo("Paused 1 work(s)");
            verify(processLauncher).kill("backup", process);
            assertThat(daemonRuntime.work(3)).get().extracting(WorkHandle::status).isEqualTo(WorkStatus.PAUSED);
        }
    }

    @Nested
    @DisplayName("Query Tests")
    class QueryTests {

        @Test
        @DisplayName("Should list enabled and disabled entries")
        void shouldListAll() {
            var process = new SpawnedProcess(100L, null);
            track(3, process);

            List<WorkResponse> responses = entryManagementService.listEntries(TOKEN);

            assertThat(responses).extracting(WorkResponse::getId).containsExactly(3L, 7L);
            var running = responses.get(0);
            assertThat(running.getStatus()).isEqualTo(WorkStatus.RUNNING);
            assertThat(running.getNextExecTime()).isNotNull();
            assertThat(running.getPids()).containsExactly(100L);
            var disabled = responses.get(1);
            assertThat(disabled.isEnabled()).isFalse();
            assertThat(disabled.getNextExecTime()).isNull();
        }

        @Test
        @DisplayName("Should detail matching entries")
        void shouldDetail() {
            var responses = entryManagementService.detailEntry(TOKEN, new EntryIdentifier.Name("backup"));

            assertThat(responses).singleElement().extracting(WorkResponse::getName).isEqualTo("backup");
        }

        @Test
        @DisplayName("Should throw when detailing an unknown entry")
        void shouldThrowForUnknownDetail() {
            assertThatThrownBy(() -> entryManagementService.detailEntry(TOKEN, new EntryIdentifier.Id(42)))
                    .isInstanceOf(EntryNotFoundException.class);
        }
    }

    @Test
    @DisplayName("Should flip the daemon status and request shutdown")
    void shouldStopDaemon() {
        var message = entryManagementService.stopDaemon(TOKEN);

        assertThat(message).isEqualTo("Daemon stopping");
        assertThat(daemonRuntime.isRunning()).isFalse();
        verify(eventPublisher).publishEvent(any(DaemonStopRequestedEvent.class));
    }
}
