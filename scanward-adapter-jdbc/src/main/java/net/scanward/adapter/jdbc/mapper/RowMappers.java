package net.scanward.adapter.jdbc.mapper;

import net.scanward.adapter.jdbc.JdbcUtil;
import net.scanward.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class RowMappers {
    private static final Logger log = LoggerFactory.getLogger(RowMappers.class);

    private RowMappers() {}

    // --- Schedule ---
    public static Schedule toSchedule(ResultSet rs) throws SQLException {
        String id = rs.getString("ID");
        Integer interval = rs.getInt("INTERVAL_MINUTES");
        if (rs.wasNull()) interval = null;
        Integer maxRuns = rs.getInt("MAX_RUNS");
        if (rs.wasNull()) maxRuns = null;

        var recurrence = new Recurrence(
                Frequency.from(rs.getString("FREQUENCY")),
                time(id, rs.getString("TIME_OF_DAY")),
                zone(id, rs.getString("TIMEZONE")),
                days(id, rs.getString("DAYS_OF_WEEK")),
                interval,
                times(id, rs.getString("TIMES_OF_DAY"))
        );
        var lockedAt = JdbcUtil.getInstant(rs, "LOCKED_AT");
        var lock = lockedAt == null ? null : new ScheduleLock(lockedAt, rs.getString("LOCKED_BY"));

        return new Schedule(
                id,
                rs.getString("GROUP_ID"),
                rs.getString("NAME"),
                recurrence,
                new RunConfig(rs.getString("RUN_MODE"), JdbcUtil.splitCsv(rs.getString("RUN_ENTITIES"))),
                "Y".equals(rs.getString("ENABLED")),
                JdbcUtil.getInstant(rs, "NEXT_RUN_AT"),
                JdbcUtil.getInstant(rs, "LAST_RUN_AT"),
                rs.getString("LAST_RUN_ID"),
                rs.getLong("RUN_COUNT"),
                maxRuns,
                JdbcUtil.getInstant(rs, "STOP_AT"),
                lock,
                JdbcUtil.getInstant(rs, "CREATED_AT"),
                JdbcUtil.getInstant(rs, "UPDATED_AT")
        );
    }

    // --- ScheduleExecution ---
    public static ScheduleExecution toExecution(ResultSet rs) throws SQLException {
        String errMsg = rs.getString("ERROR_MESSAGE");
        String errCode = rs.getString("ERROR_CODE");
        return new ScheduleExecution(
                rs.getString("ID"),
                rs.getString("SCHEDULE_ID"),
                rs.getString("GROUP_ID"),
                JdbcUtil.getInstant(rs, "SCHEDULED_FOR"),
                JdbcUtil.getInstant(rs, "STARTED_AT"),
                ScheduleExecution.Status.from(rs.getString("STATUS")),
                rs.getString("RUN_ID"),
                errMsg == null && errCode == null ? null : new ExecutionError(errMsg, errCode),
                JdbcUtil.getInstant(rs, "COMPLETED_AT"),
                new RunConfig(rs.getString("RUN_MODE"), JdbcUtil.splitCsv(rs.getString("RUN_ENTITIES")))
        );
    }

    // --- Run ---
    public static Run toRun(ResultSet rs) throws SQLException {
        return new Run(
                rs.getString("ID"),
                Run.Status.from(rs.getString("STATUS")),
                rs.getString("TRIGGER_SOURCE"),
                JdbcUtil.getInstant(rs, "STARTED_AT"),
                JdbcUtil.getInstant(rs, "ENDED_AT"),
                rs.getString("ERROR_MESSAGE")
        );
    }

    // 잘못 저장된 값 하나 때문에 due 조회 전체가 깨지지 않도록: 경고 후 기본값. 계산기가 다시 경고한다.
    private static LocalTime time(String id, String s) {
        if (s == null) return null;
        try {
            return LocalTime.parse(s.trim());
        } catch (DateTimeException e) {
            log.warn("schedule {}: bad time_of_day '{}' ({})", id, s, e.getMessage());
            return null;
        }
    }

    private static ZoneId zone(String id, String s) {
        if (s == null || s.isBlank()) return ZoneId.of("UTC");
        try {
            return ZoneId.of(s.trim());
        } catch (DateTimeException e) {
            log.warn("schedule {}: unknown timezone '{}', using UTC", id, s);
            return ZoneId.of("UTC");
        }
    }

    private static Set<Integer> days(String id, String s) {
        Set<Integer> out = new LinkedHashSet<>();
        for (String v : JdbcUtil.splitCsv(s)) {
            try {
                out.add(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("schedule {}: bad days_of_week entry '{}'", id, v);
            }
        }
        return out;
    }

    private static List<LocalTime> times(String id, String s) {
        List<LocalTime> out = new ArrayList<>();
        for (String v : JdbcUtil.splitCsv(s)) {
            LocalTime t = time(id, v);
            if (t != null) out.add(t);
        }
        return out;
    }
}
