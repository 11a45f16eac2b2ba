package net.scanward.core.spi;

import net.scanward.core.model.Run;

import java.util.Optional;

/** run id 로 외부 작업의 현재 상태 조회. 아직 생성 전이면 empty. */
public interface RunStatusClient {
    Optional<Run> find(String runId) throws Exception;
}
