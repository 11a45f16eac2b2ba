package net.scanward.core.service;

import net.scanward.core.model.ExecutionError;
import net.scanward.core.model.Run;
import net.scanward.core.model.ScheduleExecution;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.RunStatusClient;
import net.scanward.core.spi.ScheduleExecutionRepository;
import net.scanward.core.spi.ScheduleExecutionRepository.Completion;
import net.scanward.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 진행 중 실행(started + run_id)의 외부 Run 종료 상태를 execution 으로 반영한다.
 * 방향은 Run → ScheduleExecution 한쪽뿐.
 */
public final class ExecutionSyncService {
    private static final Logger log = LoggerFactory.getLogger(ExecutionSyncService.class);

    private final ScheduleExecutionRepository executions;
    private final RunStatusClient runs;
    private final TxRunner tx;
    private final Clock clock;

    public ExecutionSyncService(ScheduleExecutionRepository executions,
                                RunStatusClient runs,
                                TxRunner tx, Clock clock) {
        this.executions = executions;
        this.runs = runs;
        this.tx = tx;
        this.clock = clock;
    }

    public SyncReport reconcileOnce(int batchSize) throws Exception {
        List<ScheduleExecution> inFlight = tx.required(() -> executions.findInFlight(batchSize));
        SyncReport r = new SyncReport(clock.now(), inFlight.size());

        List<Completion> updates = new ArrayList<>();
        for (ScheduleExecution e : inFlight) {
            Optional<Run> run;
            try {
                run = runs.find(e.runId());
            } catch (Exception ex) {
                r.failed++;
                log.warn("run status lookup failed for execution {} (run {}): {}", e.id(), e.runId(), ex.getMessage());
                continue;
            }
            // 아직 Run 문서가 없거나(디스패치 경합) 실행 중이면 다음 틱에 다시 본다
            if (run.isEmpty() || !run.get().status().terminal()) {
                r.pending++;
                continue;
            }
            updates.add(toCompletion(e, run.get(), r.timestamp));
        }

        if (!updates.isEmpty()) {
            r.completed = tx.required(() -> executions.completeAll(updates));
            log.info("{}", r);
        }
        return r;
    }

    static Completion toCompletion(ScheduleExecution e, Run run, Instant now) {
        if (run.status().successLike()) {
            return new Completion(e.id(), ScheduleExecution.Status.COMPLETED, null, now);
        }
        String msg = run.errorMessage() != null ? run.errorMessage()
                : "run " + run.id() + " ended with status " + run.status().code();
        return new Completion(e.id(), ScheduleExecution.Status.ERROR,
                new ExecutionError(msg, run.status().code()), now);
    }

    public static final class SyncReport {
        public final Instant timestamp;
        public final int inFlight;
        public int pending;
        public int completed;
        public int failed;

        SyncReport(Instant timestamp, int inFlight) {
            this.timestamp = timestamp;
            this.inFlight = inFlight;
        }

        @Override public String toString() {
            return "SyncReport{" +
                    "timestamp=" + timestamp +
                    ", inFlight=" + inFlight +
                    ", pending=" + pending +
                    ", completed=" + completed +
                    ", failed=" + failed +
                    '}';
        }
    }
}
