package net.scanward.core.spi;

import net.scanward.core.model.Schedule;
import net.scanward.core.model.ScheduleLock;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {
    /** enabled = true AND next_run_at <= now, next_run_at 오름차순, 최대 limit 건 */
    List<Schedule> findDue(Instant now, int limit) throws Exception;

    Optional<Schedule> findById(String id) throws Exception;

    /** 트랜잭션 안에서 재조회 + 행 잠금 (동시 선점자는 여기서 직렬화된다) */
    Optional<Schedule> findByIdForUpdate(String id) throws Exception;

    /** 선점 확정: 락 설정 + run_count / next_run_at 갱신 (+ max_runs 도달 시 enabled=false) */
    void claim(String id, ScheduleLock lock, Instant nextRunAt, long runCount, boolean enabled) throws Exception;

    /** 트리거 성공 기록 + 락 해제 */
    void recordDispatch(String id, Instant lastRunAt, String lastRunId) throws Exception;

    void releaseLock(String id) throws Exception;

    /** enabled 토글 (락 해제 포함). nextRunAt 이 null 이면 기존 값 유지 */
    void setEnabled(String id, boolean enabled, Instant nextRunAt) throws Exception;

    /**
     * 정의 필드 + next_run_at upsert. 기존 행의 enabled / run_count / last_run_* / 락은 보존한다.
     * 단, 새 max_runs 가 이미 소진됐으면 enabled=false.
     */
    Schedule upsert(Schedule schedule) throws Exception;
}
