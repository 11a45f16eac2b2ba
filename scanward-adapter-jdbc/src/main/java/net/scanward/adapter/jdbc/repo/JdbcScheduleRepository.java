package net.scanward.adapter.jdbc.repo;

import net.scanward.adapter.jdbc.TxContext;
import net.scanward.adapter.jdbc.mapper.RowMappers;
import net.scanward.core.model.Recurrence;
import net.scanward.core.model.Schedule;
import net.scanward.core.model.ScheduleLock;
import net.scanward.core.spi.ScheduleRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import static net.scanward.adapter.jdbc.JdbcUtil.*;

public final class JdbcScheduleRepository implements ScheduleRepository {
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    @Override
    public List<Schedule> findDue(Instant now, int limit) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_SCHEDULE
                 WHERE ENABLED = 'Y'
                   AND NEXT_RUN_AT <= ?
                 ORDER BY NEXT_RUN_AT ASC, ID ASC
                 FETCH FIRST ? ROWS ONLY
            """)) {
            setInstant(ps, 1, now);
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    @Override
    public Optional<Schedule> findById(String id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_SCHEDULE WHERE ID = ?")) {
            ps.setString(1, id);
            return one(ps);
        }
    }

    /** 행 잠금: 동시에 선점하려는 쪽은 커밋까지 대기 후 갱신된 락/next_run_at 을 본다 */
    @Override
    public Optional<Schedule> findByIdForUpdate(String id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_SCHEDULE WHERE ID = ? FOR UPDATE")) {
            ps.setString(1, id);
            return one(ps);
        }
    }

    @Override
    public void claim(String id, ScheduleLock lock, Instant nextRunAt, long runCount, boolean enabled) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET LOCKED_AT   = ?,
                       LOCKED_BY   = ?,
                       NEXT_RUN_AT = ?,
                       RUN_COUNT   = ?,
                       ENABLED     = ?,
                       UPDATED_AT  = SYS_EXTRACT_UTC(SYSTIMESTAMP)
                 WHERE ID = ?
            """)) {
            setInstant(ps, 1, lock.lockedAt());
            ps.setString(2, lock.lockedBy());
            setInstant(ps, 3, nextRunAt);
            ps.setLong(4, runCount);
            ps.setString(5, yn(enabled));
            ps.setString(6, id);
            mustUpdate(ps, id);
        }
    }

    @Override
    public void recordDispatch(String id, Instant lastRunAt, String lastRunId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET LAST_RUN_AT = ?,
                       LAST_RUN_ID = ?,
                       LOCKED_AT   = NULL,
                       LOCKED_BY   = NULL,
                       UPDATED_AT  = SYS_EXTRACT_UTC(SYSTIMESTAMP)
                 WHERE ID = ?
            """)) {
            setInstant(ps, 1, lastRunAt);
            ps.setString(2, lastRunId);
            ps.setString(3, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void releaseLock(String id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET LOCKED_AT = NULL, LOCKED_BY = NULL, UPDATED_AT = SYS_EXTRACT_UTC(SYSTIMESTAMP)
                 WHERE ID = ?
            """)) {
            ps.setString(1, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void setEnabled(String id, boolean enabled, Instant nextRunAt) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET ENABLED     = ?,
                       NEXT_RUN_AT = COALESCE(?, NEXT_RUN_AT),
                       LOCKED_AT   = NULL,
                       LOCKED_BY   = NULL,
                       UPDATED_AT  = SYS_EXTRACT_UTC(SYSTIMESTAMP)
                 WHERE ID = ?
            """)) {
            ps.setString(1, yn(enabled));
            setInstant(ps, 2, nextRunAt);
            ps.setString(3, id);
            mustUpdate(ps, id);
        }
    }

    @Override
    public Schedule upsert(Schedule s) throws Exception {
        // Oracle MERGE (ID 기준). 매칭 시 스케줄링 상태(ENABLED, RUN_COUNT, LAST_RUN_*, 락)는 그대로 둔다.
        // 새 MAX_RUNS 가 이미 소진된 경우에만 ENABLED 를 내린다.
        var sql = """
            MERGE INTO TB_SCHEDULE d
            USING (SELECT ? ID FROM dual) s
               ON (d.ID = s.ID)
            WHEN MATCHED THEN UPDATE SET
                 GROUP_ID = ?, NAME = ?, FREQUENCY = ?, TIME_OF_DAY = ?, TIMEZONE = ?,
                 DAYS_OF_WEEK = ?, INTERVAL_MINUTES = ?, TIMES_OF_DAY = ?, RUN_MODE = ?, RUN_ENTITIES = ?,
                 MAX_RUNS = ?, STOP_AT = ?,
                 ENABLED = CASE WHEN d.RUN_COUNT >= NVL(?, d.RUN_COUNT + 1) THEN 'N' ELSE d.ENABLED END,
                 NEXT_RUN_AT = ?, UPDATED_AT = SYS_EXTRACT_UTC(SYSTIMESTAMP)
            WHEN NOT MATCHED THEN INSERT
                 (GROUP_ID, NAME, FREQUENCY, TIME_OF_DAY, TIMEZONE,
                  DAYS_OF_WEEK, INTERVAL_MINUTES, TIMES_OF_DAY, RUN_MODE, RUN_ENTITIES,
                  MAX_RUNS, STOP_AT, ENABLED, NEXT_RUN_AT, ID, RUN_COUNT, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0,
                    SYS_EXTRACT_UTC(SYSTIMESTAMP), SYS_EXTRACT_UTC(SYSTIMESTAMP))
            """;
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, s.id());
            i = bindDefinition(ps, i, s);
            setNullableInt(ps, i++, s.maxRuns());
            setInstant(ps, i++, s.nextRunAt());
            i = bindDefinition(ps, i, s);
            ps.setString(i++, yn(s.enabled()));
            setInstant(ps, i++, s.nextRunAt());
            ps.setString(i, s.id());
            ps.executeUpdate();
        }
        return findById(s.id()).orElseThrow(() -> new IllegalStateException("upsert failed to load schedule: " + s.id()));
    }

    // GROUP_ID .. STOP_AT (12개)
    private static int bindDefinition(PreparedStatement ps, int i, Schedule s) throws SQLException {
        Recurrence r = s.recurrence();
        ps.setString(i++, s.groupId());
        ps.setString(i++, s.name());
        ps.setString(i++, r.frequency().code());
        ps.setString(i++, r.timeOfDay() == null ? null : r.timeOfDay().format(HH_MM));
        ps.setString(i++, r.zone().getId());
        ps.setString(i++, csv(new TreeSet<>(r.daysOfWeek())));
        setNullableInt(ps, i++, r.intervalMinutes());
        List<String> times = new ArrayList<>();
        for (LocalTime t : r.timesOfDay()) times.add(t.format(HH_MM));
        ps.setString(i++, csv(times));
        ps.setString(i++, s.runConfig().mode());
        ps.setString(i++, clip(csv(s.runConfig().entities())));
        setNullableInt(ps, i++, s.maxRuns());
        setInstant(ps, i++, s.stopAt());
        return i;
    }

    private static void mustUpdate(PreparedStatement ps, String id) throws SQLException {
        if (ps.executeUpdate() == 0) {
            throw new IllegalStateException("TB_SCHEDULE not found for ID=" + id);
        }
    }

    private static Optional<Schedule> one(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toSchedule(rs)) : Optional.empty();
        }
    }

    private static List<Schedule> list(PreparedStatement ps) throws SQLException {
        List<Schedule> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toSchedule(rs));
        }
        return out;
    }
}
