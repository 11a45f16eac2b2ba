package net.scanward.adapter.jdbc.repo;

import net.scanward.adapter.jdbc.TxContext;
import net.scanward.adapter.jdbc.mapper.RowMappers;
import net.scanward.core.model.Run;
import net.scanward.core.spi.RunRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.scanward.adapter.jdbc.JdbcUtil.clip;
import static net.scanward.adapter.jdbc.JdbcUtil.setInstant;

public final class JdbcRunRepository implements RunRepository {

    @Override
    public Optional<Run> findById(String runId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_RUN WHERE ID = ?")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toRun(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Run> findStuckRunning(Instant startedBefore, int limit) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_RUN
                 WHERE STATUS = 'running'
                   AND STARTED_AT < ?
                 ORDER BY STARTED_AT ASC, ID ASC
                 FETCH FIRST ? ROWS ONLY
            """)) {
            setInstant(ps, 1, startedBefore);
            ps.setInt(2, limit);
            List<Run> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toRun(rs));
            }
            return out;
        }
    }

    /** 조건부 갱신: 그 사이 러너가 스스로 끝냈다면 덮어쓰지 않는다 */
    @Override
    public boolean markTimedOut(String runId, Instant endedAt, String errorMessage) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_RUN
                   SET STATUS        = 'timeout',
                       ENDED_AT      = ?,
                       ERROR_MESSAGE = ?
                 WHERE ID = ?
                   AND STATUS = 'running'
            """)) {
            setInstant(ps, 1, endedAt);
            ps.setString(2, clip(errorMessage));
            ps.setString(3, runId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void appendLog(String runId, String level, String message, Instant at) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "INSERT INTO TB_RUN_LOG (RUN_ID, LOG_LEVEL, MESSAGE, CREATED_AT) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, runId);
            ps.setString(2, level);
            ps.setString(3, clip(message));
            setInstant(ps, 4, at);
            ps.executeUpdate();
        }
    }
}
