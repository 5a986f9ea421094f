package com.example.cronkeeper.domain.entity;

import com.example.cronkeeper.domain.action.Action;
import com.example.cronkeeper.domain.action.Execute;
import com.example.cronkeeper.domain.action.SpawnedProcess;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.domain.time.DateTime;
import com.example.cronkeeper.domain.time.Duration;
import com.example.cronkeeper.domain.time.TimeZone;
import com.example.cronkeeper.domain.trigger.Timer;
import com.example.cronkeeper.domain.trigger.Trigger;
import com.example.cronkeeper.domain.trigger.TriggerState;
import com.example.cronkeeper.exception.InvalidTimeException;
import com.example.cronkeeper.exception.TriggerPolicyException;
import com.example.cronkeeper.exception.TriggerPolicyException.Violation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Work Tests")
class WorkTest {

    private static final DateTime NOW = DateTime.of(2024, 1, 1, 12, 0, 0, new TimeZone.Utc()).orElseThrow();

    private static final Execute ECHO = Execute.builder().executable("/bin/echo").args(List.of("hi")).build();

    private static Work workWith(Trigger trigger) {
        var entry = Entry.builder()
                .id(1)
                .name("job")
                .action(Action.exec(ECHO))
                .trigger(trigger)
                .build();
        return Work.fromEntry(entry, NOW);
    }

    private static DateTime plusDays(int days) {
        return NOW.plus(Duration.ofDays(days)).orElseThrow();
    }

    @Nested
    @DisplayName("Repeat Timer Tests")
    class RepeatTests {

        @Test
        @DisplayName("Should advance the due time by one period per start")
        void shouldAdvanceDueTime() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.oneDay())));
            assertThat(work.getTriggerState().getExecTime()).isEqualTo(plusDays(1));
            assertThat(work.getTriggerState().getExecTimes()).isZero();

            var execute = work.prepareStart();

            assertThat(execute).contains(ECHO);
            assertThat(work.getTriggerState().getExecTime()).isEqualTo(plusDays(2));
            assertThat(work.getTriggerState().getExecTimes()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should become running once the process is recorded")
        void shouldBecomeRunning() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.oneDay())));

            work.prepareStart();
            work.recordStart(new SpawnedProcess(42L, null));

            assertThat(work.getStatus()).isEqualTo(WorkStatus.RUNNING);
            assertThat(work.getRunningProcesses()).extracting(SpawnedProcess::getPid).containsExactly(42L);
        }

        @Test
        @DisplayName("Should fail with an invalid time when there is no due time to advance")
        void shouldFailWithoutDueTime() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.oneDay())));
            work.setTriggerState(new TriggerState(null, 0));

            assertThatThrownBy(work::prepareStart).isInstanceOf(InvalidTimeException.class);
            assertThat(work.getTriggerState().getExecTimes()).isZero();
        }
    }

    @Nested
    @DisplayName("ManyTimes Timer Tests")
    class ManyTimesTests {

        @Test
        @DisplayName("Should allow exactly n starts")
        void shouldAllowExactlyNStarts() {
            var work = workWith(Trigger.timer(new Timer.ManyTimes(Duration.oneDay(), 3)));

            var previous = 0;
            for (var i = 0; i < 3; i++) {
                assertThat(work.prepareStart()).isPresent();
                assertThat(work.getTriggerState().getExecTimes()).isGreaterThan(previous);
                previous = work.getTriggerState().getExecTimes();
            }

            assertThatThrownBy(work::prepareStart)
                    .isInstanceOf(TriggerPolicyException.class)
                    .extracting("violation")
                    .isEqualTo(Violation.MANY_TIMES_EXCEEDED);
            assertThat(work.getTriggerState().getExecTimes()).isEqualTo(3);
            assertThat(work.getTriggerState().getExecTime()).isEqualTo(plusDays(4));
        }
    }

    @Nested
    @DisplayName("Once Timer Tests")
    class OnceTests {

        @Test
        @DisplayName("Should start once and pause itself")
        void shouldStartOnceAndPause() {
            var at = plusDays(3);
            var work = workWith(Trigger.timer(new Timer.Once(at)));

            assertThat(work.prepareStart()).isPresent();
            work.recordStart(new SpawnedProcess(7L, null));

            assertThat(work.getStatus()).isEqualTo(WorkStatus.PAUSED);
            assertThat(work.getTriggerState().getExecTimes()).isEqualTo(1);
            assertThat(work.getTriggerState().getExecTime()).isEqualTo(at);
        }

        @Test
        @DisplayName("Should fail on the second start")
        void shouldFailOnSecondStart() {
            var work = workWith(Trigger.timer(new Timer.Once(plusDays(3))));
            work.prepareStart();

            assertThatThrownBy(work::prepareStart)
                    .isInstanceOf(TriggerPolicyException.class)
                    .extracting("violation")
                    .isEqualTo(Violation.ONCE_EXECUTED_TWICE);
        }
    }

    @Nested
    @DisplayName("Policy Violation Tests")
    class ViolationTests {

        @Test
        @DisplayName("Should refuse to start a never timer")
        void shouldRefuseNever() {
            var work = workWith(Trigger.timer(new Timer.Never()));

            assertThatThrownBy(work::prepareStart)
                    .isInstanceOf(TriggerPolicyException.class)
                    .extracting("violation")
                    .isEqualTo(Violation.NEVER_FIRED);
        }

        @Test
        @DisplayName("Should refuse to start without a trigger and leave the status alone")
        void shouldRefuseWithoutTrigger() {
            var work = workWith(Trigger.none());

            assertThatThrownBy(work::prepareStart)
                    .isInstanceOf(TriggerPolicyException.class)
                    .extracting("violation")
                    .isEqualTo(Violation.NO_TRIGGER);
            assertThat(work.getStatus()).isEqualTo(WorkStatus.PENDING);
        }

        @Test
        @DisplayName("Should do nothing for an entry without action")
        void shouldIgnoreNoAction() {
            var entry = Entry.builder().id(2).name("idle").trigger(Trigger.timer(new Timer.Never())).build();
            var work = Work.fromEntry(entry, NOW);

            assertThat(work.prepareStart()).isEmpty();
            assertThat(work.prepareStop()).isEmpty();
            assertThat(work.getStatus()).isEqualTo(WorkStatus.PENDING);
        }
    }

    @Nested
    @DisplayName("Stop And Reap Tests")
    class StopTests {

        @Test
        @DisplayName("Should forget stopped processes and pause")
        void shouldForgetStoppedProcesses() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.oneDay())));
            var first = new SpawnedProcess(1L, null);
            var second = new SpawnedProcess(2L, null);
            work.recordStart(first);
            work.recordStart(second);

            var targets = work.prepareStop().orElseThrow();
            work.recordStop(List.of(first));

            assertThat(targets).containsExactly(first, second);
            assertThat(work.getRunningProcesses()).containsExactly(second);
            assertThat(work.getStatus()).isEqualTo(WorkStatus.PAUSED);
        }

        @Test
        @DisplayName("Should return to pending when the last process exits")
        void shouldReturnToPendingWhenProcessesExit() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.oneDay())));
            var process = new SpawnedProcess(1L, null);
            work.recordStart(process);

            var forgotten = work.forgetExited(List.of(process));

            assertThat(forgotten).isEqualTo(1);
            assertThat(work.getStatus()).isEqualTo(WorkStatus.PENDING);
        }

        @Test
        @DisplayName("Should keep a paused status when processes exit")
        void shouldKeepPausedStatus() {
            var work = workWith(Trigger.timer(new Timer.Once(plusDays(1))));
            work.prepareStart();
            var process = new SpawnedProcess(1L, null);
            work.recordStart(process);

            work.forgetExited(List.of(process));

            assertThat(work.getStatus()).isEqualTo(WorkStatus.PAUSED);
        }
    }

    @Nested
    @DisplayName("isDue Tests")
    class IsDueTests {

        @Test
        @DisplayName("Should be due once the due time has passed")
        void shouldBeDueWhenPassed() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.oneDay())));
            var dueAt = Instant.ofEpochSecond(plusDays(1).getTimestamp());

            assertThat(work.isDue(dueAt.minusSeconds(1))).isFalse();
            assertThat(work.isDue(dueAt)).isTrue();
        }

        @Test
        @DisplayName("Should not be due while paused or errored")
        void shouldNotBeDueWhenNotSchedulable() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.oneDay())));
            var later = Instant.ofEpochSecond(plusDays(5).getTimestamp());

            work.setStatus(WorkStatus.PAUSED);
            assertThat(work.isDue(later)).isFalse();

            work.setStatus(WorkStatus.ERROR);
            assertThat(work.isDue(later)).isFalse();

            work.setStatus(WorkStatus.RUNNING);
            assertThat(work.isDue(later)).isTrue();
        }

        @Test
        @DisplayName("Should never be due without a due time")
        void shouldNotBeDueWithoutDueTime() {
            var work = workWith(Trigger.timer(new Timer.Never()));

            assertThat(work.isDue(Instant.now().plusSeconds(1_000_000))).isFalse();
        }
    }

    @Nested
    @DisplayName("skipMissedFirings Tests")
    class SkipMissedFiringsTests {

        private Instant at(DateTime time) {
            return Instant.ofEpochSecond(time.getTimestamp());
        }

        @Test
        @DisplayName("Should move past every elapsed slot without counting a run")
        void shouldSkipElapsedSlots() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.oneDay())));

            var skipped = work.skipMissedFirings(at(plusDays(3)).plusSeconds(3600));

            assertThat(skipped).isEqualTo(3);
            assertThat(work.getTriggerState().getExecTime()).isEqualTo(plusDays(4));
            assertThat(work.getTriggerState().getExecTimes()).isZero();
        }

        @Test
        @DisplayName("Should leave the run budget of a limited timer alone")
        void shouldKeepManyTimesBudget() {
            var work = workWith(Trigger.timer(new Timer.ManyTimes(Duration.oneDay(), 2)));

            work.skipMissedFirings(at(plusDays(1)));

            assertThat(work.getTriggerState().getExecTime()).isEqualTo(plusDays(2));
            assertThat(work.getTriggerState().getExecTimes()).isZero();
        }

        @Test
        @DisplayName("Should not move a one-shot timer")
        void shouldIgnoreOnce() {
            var work = workWith(Trigger.timer(new Timer.Once(plusDays(1))));

            assertThat(work.skipMissedFirings(at(plusDays(5)))).isZero();
            assertThat(work.getTriggerState().getExecTime()).isEqualTo(plusDays(1));
        }

        @Test
        @DisplayName("Should reject a period that does not advance time")
        void shouldRejectZeroPeriod() {
            var work = workWith(Trigger.timer(new Timer.Repeat(Duration.of(0, 0, 0, 0, 0, 0))));

            assertThatThrownBy(() -> work.skipMissedFirings(at(NOW).plusSeconds(1)))
                    .isInstanceOf(InvalidTimeException.class);
        }
    }
}
