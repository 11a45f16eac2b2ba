package net.scanward.core.spi;

import net.scanward.core.model.ExecutionError;
import net.scanward.core.model.ScheduleExecution;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleExecutionRepository {
    void insert(ScheduleExecution execution) throws Exception;

    void linkRun(String executionId, String runId) throws Exception;

    /** STARTED → ERROR (트리거 호출 자체가 실패한 경우) */
    void markError(String executionId, ExecutionError error, Instant completedAt) throws Exception;

    /** status = STARTED AND run_id IS NOT NULL, started_at 오름차순 */
    List<ScheduleExecution> findInFlight(int limit) throws Exception;

    /** STARTED 인 건만 일괄 종료. 실제 반영된 건수 반환 */
    int completeAll(List<Completion> completions) throws Exception;

    Optional<ScheduleExecution> findById(String id) throws Exception;

    /** 최근 실행 이력 (started_at 내림차순) */
    List<ScheduleExecution> findBySchedule(String scheduleId, int limit) throws Exception;

    record Completion(String executionId, ScheduleExecution.Status status, ExecutionError error, Instant completedAt) {}
}
