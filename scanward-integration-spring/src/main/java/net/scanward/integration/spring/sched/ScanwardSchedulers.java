package net.scanward.integration.spring.sched;

import net.scanward.core.maintenance.MaintenanceService;
import net.scanward.core.service.ExecutionSyncService;
import net.scanward.core.service.ScheduleTickService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class ScanwardSchedulers {
    private final ScheduleTickService poller;
    private final ExecutionSyncService reconciler;
    private final MaintenanceService maintenance;

    private int pollBatchSize = 25;
    private int reconcileBatchSize = 50;
    private int janitorBatchSize = 50;
    private Duration runTimeout = Duration.ofMinutes(30);

    public ScanwardSchedulers(ScheduleTickService poller,
                              ExecutionSyncService reconciler,
                              MaintenanceService maintenance) {
        this.poller = poller;
        this.reconciler = reconciler;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${scanward.scheduler.poll-delay-ms:60000}")
    public void poll() throws Exception {
        poller.tickOnce(pollBatchSize);
    }

    @Scheduled(fixedDelayString = "${scanward.scheduler.reconcile-delay-ms:120000}")
    public void reconcile() throws Exception {
        reconciler.reconcileOnce(reconcileBatchSize);
    }

    @Scheduled(fixedDelayString = "${scanward.scheduler.janitor-delay-ms:600000}")
    public void janitor() throws Exception {
        maintenance.runOnce(runTimeout, janitorBatchSize);
    }

    public void setPollBatchSize(int pollBatchSize) {
        this.pollBatchSize = pollBatchSize;
    }

    public void setReconcileBatchSize(int reconcileBatchSize) {
        this.reconcileBatchSize = reconcileBatchSize;
    }

    public void setJanitorBatchSize(int janitorBatchSize) {
        this.janitorBatchSize = janitorBatchSize;
    }

    public void setRunTimeout(Duration runTimeout) {
        this.runTimeout = runTimeout;
    }
}
