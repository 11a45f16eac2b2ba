package net.scanward.core.maintenance;

import net.scanward.core.model.Run;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.RunRepository;
import net.scanward.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 멈춘 Run 정리 (hung-job janitor).
 * 종료 보고 없이 running 에 머문 Run 을 timeout 으로 강제 종료한다.
 * Schedule / ScheduleExecution 은 건드리지 않는다. execution 반영은 다음 reconcile 틱의 몫.
 */
public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final RunRepository runs;
    private final TxRunner tx;
    private final Clock clock;

    public static final String DEFAULT_TIMEOUT_REASON = "run exceeded maximum duration of %d minutes; terminated by maintenance";

    public MaintenanceService(RunRepository runs, TxRunner tx, Clock clock) {
        this.runs = runs;
        this.tx = tx;
        this.clock = clock;
    }

    public MaintenanceReport runOnce(Duration runTimeout, int batchSize) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();
        r.timestamp = now;

        List<Run> stuck = tx.required(() -> runs.findStuckRunning(now.minus(runTimeout), batchSize));
        r.stuckRuns = stuck.size();

        String reason = String.format(DEFAULT_TIMEOUT_REASON, runTimeout.toMinutes());
        for (Run run : stuck) {
            try {
                boolean changed = tx.requiresNew(() -> {
                    if (!runs.markTimedOut(run.id(), now, reason)) return false;   // 그 사이 종료됨
                    runs.appendLog(run.id(), "error", "Run timed out: " + reason, now);
                    return true;
                });
                if (changed) {
                    r.timedOut++;
                    log.warn("run {} running since {} marked timeout", run.id(), run.startedAt());
                }
            } catch (Exception e) {
                r.failed++;
                log.warn("could not time out run {}: {}", run.id(), e.getMessage(), e);
            }
        }

        if (r.stuckRuns > 0) log.info("{}", r);
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int stuckRuns;
        public int timedOut;
        public int failed;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", stuckRuns=" + stuckRuns +
                    ", timedOut=" + timedOut +
                    ", failed=" + failed +
                    '}';
        }
    }
}
