package net.scanward.adapter.jdbc.repo;

import net.scanward.adapter.jdbc.TxContext;
import net.scanward.adapter.jdbc.mapper.RowMappers;
import net.scanward.core.model.ExecutionError;
import net.scanward.core.model.ScheduleExecution;
import net.scanward.core.spi.ScheduleExecutionRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.scanward.adapter.jdbc.JdbcUtil.*;

public final class JdbcScheduleExecutionRepository implements ScheduleExecutionRepository {

    @Override
    public void insert(ScheduleExecution e) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_SCHEDULE_EXECUTION
                       (ID, SCHEDULE_ID, GROUP_ID, SCHEDULED_FOR, STARTED_AT, STATUS, RUN_ID, RUN_MODE, RUN_ENTITIES)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            ps.setString(1, e.id());
            ps.setString(2, e.scheduleId());
            ps.setString(3, e.groupId());
            setInstant(ps, 4, e.scheduledFor());
            setInstant(ps, 5, e.startedAt());
            ps.setString(6, e.status().code());
            ps.setString(7, e.runId());
            ps.setString(8, e.runConfig() == null ? null : e.runConfig().mode());
            ps.setString(9, e.runConfig() == null ? null : clip(csv(e.runConfig().entities())));
            ps.executeUpdate();
        }
    }

    @Override
    public void linkRun(String executionId, String runId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "UPDATE TB_SCHEDULE_EXECUTION SET RUN_ID = ? WHERE ID = ?")) {
            ps.setString(1, runId);
            ps.setString(2, executionId);
            ps.executeUpdate();
        }
    }

    @Override
    public void markError(String executionId, ExecutionError error, Instant completedAt) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE_EXECUTION
                   SET STATUS        = 'error',
                       ERROR_MESSAGE = ?,
                       ERROR_CODE    = ?,
                       COMPLETED_AT  = ?
                 WHERE ID = ?
                   AND STATUS = 'started'
            """)) {
            ps.setString(1, clip(error.message()));
            ps.setString(2, error.code());
            setInstant(ps, 3, completedAt);
            ps.setString(4, executionId);
            ps.executeUpdate();
        }
    }

    @Override
    public List<ScheduleExecution> findInFlight(int limit) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_SCHEDULE_EXECUTION
                 WHERE STATUS = 'started'
                   AND RUN_ID IS NOT NULL
                 ORDER BY STARTED_AT ASC, ID ASC
                 FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setInt(1, limit);
            return list(ps);
        }
    }

    /** 한 트랜잭션 안에서 JDBC batch 로 일괄 반영. STARTED 가 아닌 건은 무시된다. */
    @Override
    public int completeAll(List<Completion> completions) throws Exception {
        if (completions.isEmpty()) return 0;
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE_EXECUTION
                   SET STATUS        = ?,
                       ERROR_MESSAGE = ?,
                       ERROR_CODE    = ?,
                       COMPLETED_AT  = ?
                 WHERE ID = ?
                   AND STATUS = 'started'
            """)) {
            for (Completion c : completions) {
                ps.setString(1, c.status().code());
                ps.setString(2, c.error() == null ? null : clip(c.error().message()));
                ps.setString(3, c.error() == null ? null : c.error().code());
                setInstant(ps, 4, c.completedAt());
                ps.setString(5, c.executionId());
                ps.addBatch();
            }
            int applied = 0;
            for (int n : ps.executeBatch()) {
                if (n > 0) applied += n;
                else if (n == Statement.SUCCESS_NO_INFO) applied++;
            }
            return applied;
        }
    }

    @Override
    public Optional<ScheduleExecution> findById(String id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_SCHEDULE_EXECUTION WHERE ID = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toExecution(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<ScheduleExecution> findBySchedule(String scheduleId, int limit) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_SCHEDULE_EXECUTION
                 WHERE SCHEDULE_ID = ?
                 ORDER BY STARTED_AT DESC, ID DESC
                 FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setString(1, scheduleId);
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    private static List<ScheduleExecution> list(PreparedStatement ps) throws SQLException {
        List<ScheduleExecution> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toExecution(rs));
        }
        return out;
    }
}
