package net.scanward.core.model;

import java.time.Instant;
import java.util.Locale;

public record ScheduleExecution(
        String id,
        String scheduleId,
        String groupId,
        Instant scheduledFor,   // 이 발화를 일으킨 next_run_at 값
        Instant startedAt,
        Status status,          // STARTED → COMPLETED | ERROR
        String runId,           // 트리거 성공 후에만 채워짐
        ExecutionError error,
        Instant completedAt,
        RunConfig runConfig
) {
    public enum Status {
        STARTED, COMPLETED, ERROR, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public static ScheduleExecution started(String id, Schedule s, Instant now) {
        return new ScheduleExecution(id, s.id(), s.groupId(), s.nextRunAt(), now,
                Status.STARTED, null, null, null, s.runConfig());
    }
}
