package net.scanward.core.service;

import net.scanward.core.model.Recurrence;
import net.scanward.core.model.RunConfig;
import net.scanward.core.model.Schedule;
import net.scanward.core.model.ScheduleExecution;
import net.scanward.core.model.ScheduleLock;
import net.scanward.core.service.ScheduleDispatchService.Outcome;
import net.scanward.core.spi.RunTriggerException;
import net.scanward.core.support.FakeRunTrigger;
import net.scanward.core.support.InMemoryStore;
import net.scanward.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleDispatchServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-20T10:00:00Z");
    private static final Duration GRACE = Duration.ofMinutes(5);

    private InMemoryStore store;
    private MutableClock clock;
    private FakeRunTrigger trigger;
    private ScheduleDispatchService dispatcher;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        clock = new MutableClock(NOW);
        trigger = new FakeRunTrigger(store, clock);
        AtomicInteger seq = new AtomicInteger();
        dispatcher = new ScheduleDispatchService(store.schedules, store.executions, trigger,
                new RecurrenceCalculator(), store, clock, "node-a", GRACE,
                () -> "exec-" + seq.incrementAndGet());
    }

    private static Schedule due(String id, Integer maxRuns, Instant stopAt, long runCount, ScheduleLock lock) {
        return new Schedule(id, "grp", id, Recurrence.daily(LocalTime.of(9, 0), ZoneId.of("UTC")),
                new RunConfig("full", List.of("customers")), true,
                NOW.minusSeconds(60), null, null, runCount, maxRuns, stopAt, lock, NOW, NOW);
    }

    @Test
    void claims_advances_and_links_run() throws Exception {
        store.put(due("s1", null, null, 0, null));

        Outcome o = dispatcher.claimAndDispatch("s1");

        assertThat(o).isEqualTo(Outcome.DISPATCHED);
        Schedule s = store.schedule("s1");
        assertThat(s.nextRunAt()).isEqualTo(Instant.parse("2024-03-21T09:00:00Z"));
        assertThat(s.runCount()).isEqualTo(1);
        assertThat(s.lock()).isNull();
        assertThat(s.lastRunId()).isEqualTo("run-1");
        assertThat(s.enabled()).isTrue();

        ScheduleExecution e = store.execution("exec-1");
        assertThat(e.status()).isEqualTo(ScheduleExecution.Status.STARTED);
        assertThat(e.runId()).isEqualTo("run-1");
        assertThat(e.scheduledFor()).isEqualTo(NOW.minusSeconds(60));
        assertThat(e.runConfig().mode()).isEqualTo("full");

        assertThat(trigger.requests).singleElement().satisfies(r -> {
            assertThat(r.scheduleId()).isEqualTo("s1");
            assertThat(r.executionId()).isEqualTo("exec-1");
            assertThat(r.runConfig().entities()).containsExactly("customers");
        });
        assertThat(trigger.calledInsideTransaction).isFalse();
    }

    @Test
    void max_runs_stops_after_limit() throws Exception {
        store.put(due("s1", 3, null, 0, null));

        for (int i = 1; i <= 3; i++) {
            assertThat(dispatcher.claimAndDispatch("s1")).isEqualTo(Outcome.DISPATCHED);
            clock.set(store.schedule("s1").nextRunAt().plusSeconds(1));
        }

        Schedule s = store.schedule("s1");
        assertThat(s.runCount()).isEqualTo(3);
        assertThat(s.enabled()).isFalse();
        assertThat(dispatcher.claimAndDispatch("s1")).isEqualTo(Outcome.SKIPPED_DISABLED);
        assertThat(store.executionsOf("s1")).hasSize(3);
        assertThat(trigger.requests).hasSize(3);
    }

    @Test
    void exhausted_but_enabled_schedule_is_disabled_without_firing() throws Exception {
        store.put(due("s1", 3, null, 3, null));

        assertThat(dispatcher.claimAndDispatch("s1")).isEqualTo(Outcome.STOPPED);

        assertThat(store.schedule("s1").enabled()).isFalse();
        assertThat(store.schedule("s1").runCount()).isEqualTo(3);
        assertThat(store.executionsOf("s1")).isEmpty();
        assertThat(trigger.requests).isEmpty();
    }

    @Test
    void stop_at_in_the_past_disables() throws Exception {
        store.put(due("s1", null, NOW.minusSeconds(1), 0, null));

        assertThat(dispatcher.claimAndDispatch("s1")).isEqualTo(Outcome.STOPPED);
        assertThat(store.schedule("s1").enabled()).isFalse();
        assertThat(trigger.requests).isEmpty();
    }

    @Test
    void fresh_lock_blocks_and_stale_lock_is_taken_over() throws Exception {
        store.put(due("fresh", null, null, 0, new ScheduleLock(NOW.minus(Duration.ofMinutes(1)), "node-b")));
        store.put(due("stale", null, null, 0, new ScheduleLock(NOW.minus(Duration.ofMinutes(6)), "node-b")));

        assertThat(dispatcher.claimAndDispatch("fresh")).isEqualTo(Outcome.SKIPPED_LOCKED);
        assertThat(store.schedule("fresh").lock().lockedBy()).isEqualTo("node-b");
        assertThat(store.executionsOf("fresh")).isEmpty();

        assertThat(dispatcher.claimAndDispatch("stale")).isEqualTo(Outcome.DISPATCHED);
        assertThat(store.executionsOf("stale")).hasSize(1);
    }

    @Test
    void not_due_disabled_or_missing_is_skipped() throws Exception {
        Schedule future = due("future", null, null, 0, null).withNextRunAt(NOW.plusSeconds(30));
        Schedule off = new Schedule("off", null, "off", Recurrence.daily(LocalTime.NOON, null),
                RunConfig.defaults(), false, NOW.minusSeconds(60), null, null, 0, null, null, null, NOW, NOW);
        store.put(future);
        store.put(off);

        assertThat(dispatcher.claimAndDispatch("future")).isEqualTo(Outcome.SKIPPED_NOT_DUE);
        assertThat(dispatcher.claimAndDispatch("off")).isEqualTo(Outcome.SKIPPED_DISABLED);
        assertThat(dispatcher.claimAndDispatch("nope")).isEqualTo(Outcome.SKIPPED_DISABLED);
        assertThat(trigger.requests).isEmpty();
    }

    @Test
    void trigger_failure_marks_execution_error_and_skips_this_firing() throws Exception {
        store.put(due("s1", null, null, 0, null));
        trigger.failWith(new RunTriggerException("scan service responded 500", "HTTP_500"));

        assertThat(dispatcher.claimAndDispatch("s1")).isEqualTo(Outcome.DISPATCH_FAILED);

        ScheduleExecution e = store.execution("exec-1");
        assertThat(e.status()).isEqualTo(ScheduleExecution.Status.ERROR);
        assertThat(e.error().code()).isEqualTo("HTTP_500");
        assertThat(e.completedAt()).isEqualTo(NOW);
        assertThat(e.runId()).isNull();

        Schedule s = store.schedule("s1");
        assertThat(s.lock()).isNull();
        assertThat(s.nextRunAt()).isEqualTo(Instant.parse("2024-03-21T09:00:00Z"));
        assertThat(s.runCount()).isEqualTo(1);
        assertThat(s.lastRunId()).isNull();
    }

    @Test
    void unexpected_trigger_exception_is_recorded_as_internal() throws Exception {
        store.put(due("s1", null, null, 0, null));
        trigger.failWith(new IllegalStateException("bad config"));

        assertThat(dispatcher.claimAndDispatch("s1")).isEqualTo(Outcome.DISPATCH_FAILED);
        assertThat(store.execution("exec-1").error().code()).isEqualTo("INTERNAL");
        assertThat(store.execution("exec-1").error().message()).isEqualTo("bad config");
    }

    @Test
    void concurrent_claims_fire_exactly_once() throws Exception {
        store.put(due("s1", null, null, 0, null));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Outcome>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return dispatcher.claimAndDispatch("s1");
                }));
            }
            start.countDown();

            List<Outcome> outcomes = new ArrayList<>();
            for (Future<Outcome> f : results) outcomes.add(f.get(10, TimeUnit.SECONDS));

            assertThat(outcomes).filteredOn(o -> o == Outcome.DISPATCHED).hasSize(1);
            assertThat(outcomes).filteredOn(o -> o != Outcome.DISPATCHED)
                    .allMatch(o -> o == Outcome.SKIPPED_NOT_DUE || o == Outcome.SKIPPED_LOCKED);
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.executionsOf("s1")).hasSize(1);
        assertThat(trigger.requests).hasSize(1);
        assertThat(store.schedule("s1").runCount()).isEqualTo(1);
    }

    @Test
    void failed_read_aborts_claim_without_side_effects() {
        store.put(due("s1", null, null, 0, null));
        store.failingScheduleReads.add("s1");

        assertThatThrownBy(() -> dispatcher.claimAndDispatch("s1"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.executionsOf("s1")).isEmpty();
        assertThat(store.schedule("s1").nextRunAt()).isEqualTo(NOW.minusSeconds(60));
    }

    @Test
    void claim_write_failure_rolls_back_inserted_execution() {
        store.put(due("s1", null, null, 0, null));
        store.failingClaims.add("s1");

        assertThatThrownBy(() -> dispatcher.claimAndDispatch("s1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("claim write failed");

        // insert 는 이미 실행됐지만 같은 트랜잭션이라 함께 사라진다
        assertThat(store.executionsOf("s1")).isEmpty();
        Schedule s = store.schedule("s1");
        assertThat(s.nextRunAt()).isEqualTo(NOW.minusSeconds(60));
        assertThat(s.runCount()).isZero();
        assertThat(s.lock()).isNull();
        assertThat(trigger.requests).isEmpty();
    }

    @Test
    void bookkeeping_failure_after_trigger_still_counts_as_dispatched() throws Exception {
        store.put(due("s1", null, null, 0, null));
        store.failingDispatchRecords.add("s1");

        assertThat(dispatcher.claimAndDispatch("s1")).isEqualTo(Outcome.DISPATCHED);
        assertThat(trigger.requests).hasSize(1);

        // link + 락 해제가 함께 롤백: execution 은 run 없이 started, 락은 grace 후 만료
        ScheduleExecution e = store.execution("exec-1");
        assertThat(e.status()).isEqualTo(ScheduleExecution.Status.STARTED);
        assertThat(e.runId()).isNull();

        Schedule s = store.schedule("s1");
        assertThat(s.lock()).isEqualTo(new ScheduleLock(NOW, "node-a"));
        assertThat(s.lastRunId()).isNull();
        assertThat(s.nextRunAt()).isEqualTo(Instant.parse("2024-03-21T09:00:00Z"));

        // 락이 살아 있는 동안 같은 스케줄을 다시 당겨도 발화하지 않는다
        store.put(due("s1", null, null, s.runCount(), s.lock()));
        assertThat(dispatcher.claimAndDispatch("s1")).isEqualTo(Outcome.SKIPPED_LOCKED);
        assertThat(trigger.requests).hasSize(1);
    }
}
