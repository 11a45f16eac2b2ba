package net.scanward.core.model;

import java.time.Instant;

public record Schedule(
        String id,
        String groupId,
        String name,
        Recurrence recurrence,
        RunConfig runConfig,
        boolean enabled,
        Instant nextRunAt,
        Instant lastRunAt,
        String lastRunId,
        long runCount,
        Integer maxRuns,
        Instant stopAt,
        ScheduleLock lock,       // null = 미점유
        Instant createdAt,
        Instant updatedAt
) {
    public static Schedule ofNew(String id, String groupId, String name,
                                 Recurrence recurrence, RunConfig runConfig,
                                 Integer maxRuns, Instant stopAt) {
        return new Schedule(id, groupId, name, recurrence, runConfig, true,
                null, null, null, 0L, maxRuns, stopAt, null, null, null);
    }

    /** max_runs 또는 stop_at 에 도달했는지 */
    public boolean limitReached(Instant now) {
        if (maxRuns != null && runCount >= maxRuns) return true;
        return stopAt != null && !now.isBefore(stopAt);
    }

    public Schedule withNextRunAt(Instant next) {
        return new Schedule(id, groupId, name, recurrence, runConfig, enabled, next, lastRunAt, lastRunId,
                runCount, maxRuns, stopAt, lock, createdAt, updatedAt);
    }
}
