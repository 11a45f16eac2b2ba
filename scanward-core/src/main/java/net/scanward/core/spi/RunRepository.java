package net.scanward.core.spi;

import net.scanward.core.model.Run;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RunRepository {
    Optional<Run> findById(String runId) throws Exception;

    /** status = running AND started_at < startedBefore, 오래된 순 최대 limit 건 */
    List<Run> findStuckRunning(Instant startedBefore, int limit) throws Exception;

    /** running 인 경우에만 timeout 으로 전환. 전환됐으면 true */
    boolean markTimedOut(String runId, Instant endedAt, String errorMessage) throws Exception;

    void appendLog(String runId, String level, String message, Instant at) throws Exception;
}
