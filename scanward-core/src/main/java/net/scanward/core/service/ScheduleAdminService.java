package net.scanward.core.service;

import net.scanward.core.model.Schedule;
import net.scanward.core.model.ScheduleExecution;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.ScheduleExecutionRepository;
import net.scanward.core.spi.ScheduleRepository;
import net.scanward.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/** 운영자용 조작: 등록, 수동 활성/비활성, 다음 실행 미리보기, 실행 이력 */
public final class ScheduleAdminService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleAdminService.class);

    private final ScheduleRepository schedules;
    private final ScheduleExecutionRepository executions;
    private final RecurrenceCalculator recurrence;
    private final TxRunner tx;
    private final Clock clock;

    public ScheduleAdminService(ScheduleRepository schedules,
                                ScheduleExecutionRepository executions,
                                RecurrenceCalculator recurrence,
                                TxRunner tx, Clock clock) {
        this.schedules = schedules;
        this.executions = executions;
        this.recurrence = recurrence;
        this.tx = tx;
        this.clock = clock;
    }

    /** 반복 규칙 검증 후 첫 next_run_at 을 계산해 upsert */
    public Schedule register(Schedule s) throws Exception {
        if (s.id() == null || s.id().isBlank()) {
            throw new IllegalArgumentException("schedule id is required");
        }
        var problems = s.recurrence().problems();
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("invalid recurrence for schedule " + s.id() + ": " + problems);
        }
        Instant next = recurrence.computeNextRunAt(s.recurrence(), clock.now(), null);
        Schedule saved = tx.required(() -> schedules.upsert(s.withNextRunAt(next)));
        log.info("schedule {} registered ({}), next_run_at={}", s.id(), s.recurrence().frequency().code(), next);
        return saved;
    }

    /** 밀린 발화를 몰아서 쏘지 않도록 지금 기준으로 next_run_at 재계산 */
    public void enable(String scheduleId) throws Exception {
        tx.required(() -> {
            Schedule s = schedules.findByIdForUpdate(scheduleId)
                    .orElseThrow(() -> new NoSuchElementException("schedule not found: " + scheduleId));
            Instant next = recurrence.computeNextRunAt(s.recurrence(), clock.now(), null);
            schedules.setEnabled(scheduleId, true, next);
            log.info("schedule {} enabled, next_run_at={}", scheduleId, next);
            return null;
        });
    }

    public void disable(String scheduleId) throws Exception {
        tx.required(() -> {
            schedules.findByIdForUpdate(scheduleId)
                    .orElseThrow(() -> new NoSuchElementException("schedule not found: " + scheduleId));
            schedules.setEnabled(scheduleId, false, null);
            log.info("schedule {} disabled", scheduleId);
            return null;
        });
    }

    /** 현재 next_run_at 포함 다음 count 개 발화 시각 */
    public List<Instant> previewUpcoming(String scheduleId, int count) throws Exception {
        Schedule s = tx.required(() -> schedules.findById(scheduleId))
                .orElseThrow(() -> new NoSuchElementException("schedule not found: " + scheduleId));
        if (count <= 0) return List.of();

        Instant now = clock.now();
        List<Instant> out = new ArrayList<>(count);
        Instant seed = s.nextRunAt();
        if (seed != null && seed.isAfter(now)) {
            out.add(seed);
        }
        out.addAll(recurrence.upcoming(s.recurrence(), now, seed, count - out.size()));
        return out;
    }

    public List<ScheduleExecution> history(String scheduleId, int limit) throws Exception {
        return tx.required(() -> executions.findBySchedule(scheduleId, limit));
    }
}
