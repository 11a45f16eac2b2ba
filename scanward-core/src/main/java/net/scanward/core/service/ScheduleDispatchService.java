package net.scanward.core.service;

import net.scanward.core.model.ExecutionError;
import net.scanward.core.model.Schedule;
import net.scanward.core.model.ScheduleExecution;
import net.scanward.core.model.ScheduleLock;
import net.scanward.core.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 스케줄 하나를 선점하고 원격 스캔을 트리거한다.
 * candidate → claimed → dispatched → {linked, failed}
 */
public final class ScheduleDispatchService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleDispatchService.class);

    private final ScheduleRepository schedules;
    private final ScheduleExecutionRepository executions;
    private final RunTrigger trigger;
    private final RecurrenceCalculator recurrence;
    private final TxRunner tx;
    private final Clock clock;
    private final String instanceId;
    private final Duration lockGrace;
    private final Supplier<String> idGenerator;

    public ScheduleDispatchService(ScheduleRepository schedules,
                                   ScheduleExecutionRepository executions,
                                   RunTrigger trigger,
                                   RecurrenceCalculator recurrence,
                                   TxRunner tx, Clock clock,
                                   String instanceId, Duration lockGrace) {
        this(schedules, executions, trigger, recurrence, tx, clock, instanceId, lockGrace,
                () -> UUID.randomUUID().toString());
    }

    public ScheduleDispatchService(ScheduleRepository schedules,
                                   ScheduleExecutionRepository executions,
                                   RunTrigger trigger,
                                   RecurrenceCalculator recurrence,
                                   TxRunner tx, Clock clock,
                                   String instanceId, Duration lockGrace,
                                   Supplier<String> idGenerator) {
        this.schedules = schedules;
        this.executions = executions;
        this.trigger = trigger;
        this.recurrence = recurrence;
        this.tx = tx;
        this.clock = clock;
        this.instanceId = instanceId;
        this.lockGrace = lockGrace;
        this.idGenerator = idGenerator;
    }

    public enum Outcome {
        /** 없어졌거나 비활성 */
        SKIPPED_DISABLED,
        /** 다른 프로세스가 이미 next_run_at 을 전진시킴 */
        SKIPPED_NOT_DUE,
        /** 소프트 락이 아직 유효 */
        SKIPPED_LOCKED,
        /** max_runs / stop_at 도달 → 비활성화 */
        STOPPED,
        DISPATCHED,
        DISPATCH_FAILED
    }

    /** 선점 트랜잭션의 결과. claimed 일 때만 execution 이 있다. */
    record Claim(Outcome outcome, Schedule schedule, ScheduleExecution execution) {
        static Claim abort(Outcome o) { return new Claim(o, null, null); }
        boolean claimed() { return execution != null; }
    }

    /**
     * 선점(1~5단계, 단일 트랜잭션) 후 트랜잭션 밖에서 트리거(6~8단계).
     * 선점 단계 예외는 롤백되어 부작용 없이 호출자에게 전달된다.
     */
    public Outcome claimAndDispatch(String scheduleId) throws Exception {
        String executionId = idGenerator.get();   // 트랜잭션 재시도와 무관하게 고정

        Claim claim = tx.requiresNew(() -> claim(scheduleId, executionId));
        if (!claim.claimed()) return claim.outcome();

        return dispatch(claim.schedule(), claim.execution());
    }

    Claim claim(String scheduleId, String executionId) throws Exception {
        Instant now = clock.now();

        // 1) 재조회 (+ 행 잠금)
        var opt = schedules.findByIdForUpdate(scheduleId);
        if (opt.isEmpty() || !opt.get().enabled()) {
            log.debug("schedule {} gone or disabled, skip", scheduleId);
            return Claim.abort(Outcome.SKIPPED_DISABLED);
        }
        Schedule s = opt.get();

        // 2) 아직 due 인지
        if (s.nextRunAt() == null || s.nextRunAt().isAfter(now)) {
            log.debug("schedule {} no longer due (next_run_at={})", scheduleId, s.nextRunAt());
            return Claim.abort(Outcome.SKIPPED_NOT_DUE);
        }

        // 3) 소프트 락
        if (s.lock() != null && s.lock().isFresh(now, lockGrace)) {
            log.debug("schedule {} locked by {} at {}, skip", scheduleId, s.lock().lockedBy(), s.lock().lockedAt());
            return Claim.abort(Outcome.SKIPPED_LOCKED);
        }

        // 4) 종료 조건
        if (s.limitReached(now)) {
            schedules.setEnabled(scheduleId, false, null);
            log.info("schedule {} reached its limit (run_count={}, max_runs={}, stop_at={}), disabled",
                    scheduleId, s.runCount(), s.maxRuns(), s.stopAt());
            return Claim.abort(Outcome.STOPPED);
        }

        // 5) 선점: 락 + next_run_at 전진 + 실행 기록
        Instant next = recurrence.computeNextRunAt(s.recurrence(), now, s.nextRunAt());
        long runCount = s.runCount() + 1;
        boolean stillEnabled = s.maxRuns() == null || runCount < s.maxRuns();

        ScheduleExecution exec = ScheduleExecution.started(executionId, s, now);
        executions.insert(exec);
        schedules.claim(scheduleId, new ScheduleLock(now, instanceId), next, runCount, stillEnabled);

        log.info("claimed schedule {} for {} (run {}{}), next_run_at={}",
                scheduleId, s.nextRunAt(), runCount, s.maxRuns() == null ? "" : "/" + s.maxRuns(), next);
        return new Claim(Outcome.DISPATCHED, s, exec);
    }

    private Outcome dispatch(Schedule s, ScheduleExecution exec) {
        // 6) 원격 트리거 (트랜잭션 밖: 느린 호출이 저장소 트랜잭션을 붙잡지 않게)
        String runId;
        try {
            runId = trigger.trigger(new RunTrigger.RunRequest(s.id(), exec.id(), s.runConfig()));
        } catch (RunTriggerException e) {
            return recordFailure(s, exec, new ExecutionError(e.getMessage(), e.code()));
        } catch (Exception e) {
            return recordFailure(s, exec, new ExecutionError(String.valueOf(e.getMessage()), "INTERNAL"));
        }

        // 7) 성공: run id 연결 + 락 해제. 실패해도 락은 grace 후 자연 만료.
        try {
            tx.requiresNew(() -> {
                executions.linkRun(exec.id(), runId);
                schedules.recordDispatch(s.id(), clock.now(), runId);
                return null;
            });
            log.info("schedule {} dispatched: execution={} run={}", s.id(), exec.id(), runId);
        } catch (Exception e) {
            log.error("run {} started for schedule {} but bookkeeping failed; lock expires after {}",
                    runId, s.id(), lockGrace, e);
        }
        return Outcome.DISPATCHED;
    }

    // 8) 실패: execution=error + 락 해제. next_run_at 은 이미 전진했으므로 이번 발화는 건너뛴다.
    private Outcome recordFailure(Schedule s, ScheduleExecution exec, ExecutionError error) {
        log.warn("trigger failed for schedule {} (execution {}): [{}] {}",
                s.id(), exec.id(), error.code(), error.message());
        try {
            tx.requiresNew(() -> {
                executions.markError(exec.id(), error, clock.now());
                schedules.releaseLock(s.id());
                return null;
            });
        } catch (Exception e) {
            log.error("could not record trigger failure for execution {}; lock expires after {}",
                    exec.id(), lockGrace, e);
        }
        return Outcome.DISPATCH_FAILED;
    }
}
