package net.scanward.integration.spring.run;

import net.scanward.core.model.Run;
import net.scanward.core.spi.RunRepository;
import net.scanward.core.spi.RunStatusClient;
import net.scanward.core.spi.TxRunner;

import java.util.Optional;

/** 러너가 같은 저장소의 TB_RUN 에 상태를 쓰므로 그대로 읽는다 */
public final class StoreRunStatusClient implements RunStatusClient {
    private final RunRepository runs;
    private final TxRunner tx;

    public StoreRunStatusClient(RunRepository runs, TxRunner tx) {
        this.runs = runs;
        this.tx = tx;
    }

    @Override
    public Optional<Run> find(String runId) throws Exception {
        return tx.required(() -> runs.findById(runId));
    }
}
