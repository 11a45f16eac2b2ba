package net.scanward.bootstrap.autoconfigure;

import net.scanward.bootstrap.catalog.ScheduleCatalogRegistrar;
import net.scanward.bootstrap.props.ScanwardProperties;
import net.scanward.core.maintenance.MaintenanceService;
import net.scanward.core.service.*;
import net.scanward.core.spi.*;
import net.scanward.integration.spring.ScanwardSpringConfig;
import net.scanward.integration.spring.http.HttpRunTrigger;
import net.scanward.integration.spring.sched.ScanwardSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

@AutoConfiguration
@EnableConfigurationProperties(ScanwardProperties.class)
@Import(ScanwardSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class ScanwardAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ScanwardAutoConfiguration.class);

    // --- 외부 스캔 서비스 ---

    @Bean
    @ConditionalOnMissingBean(RunTrigger.class)
    public RunTrigger runTrigger(ScanwardProperties props) {
        var t = props.getTrigger();
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) t.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) t.getReadTimeout().toMillis());

        var builder = RestClient.builder().requestFactory(factory);
        if (t.getBaseUrl() == null || t.getBaseUrl().isBlank()) {
            log.warn("scanward.trigger.base-url is not set; every dispatch will fail until it is configured");
        } else {
            builder.baseUrl(t.getBaseUrl());
        }
        return new HttpRunTrigger(builder.build(), t.getPath(), t.getAuthToken());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public RecurrenceCalculator recurrenceCalculator() {
        return new RecurrenceCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleDispatchService scheduleDispatch(ScheduleRepository schedules,
                                                    ScheduleExecutionRepository executions,
                                                    RunTrigger trigger,
                                                    RecurrenceCalculator recurrence,
                                                    TxRunner tx,
                                                    Clock clock,
                                                    ScanwardProperties props) {
        var sp = props.getScheduler();
        return new ScheduleDispatchService(schedules, executions, trigger, recurrence, tx, clock,
                resolveInstanceId(sp.getInstanceId()), sp.getLockGrace());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleTickService scheduleTick(ScheduleRepository schedules,
                                            ScheduleDispatchService dispatch,
                                            TxRunner tx,
                                            Clock clock) {
        return new ScheduleTickService(schedules, dispatch, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionSyncService executionSync(ScheduleExecutionRepository executions,
                                              RunStatusClient runs,
                                              TxRunner tx,
                                              Clock clock) {
        return new ExecutionSyncService(executions, runs, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(RunRepository runs, TxRunner tx, Clock clock) {
        return new MaintenanceService(runs, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleAdminService scheduleAdmin(ScheduleRepository schedules,
                                              ScheduleExecutionRepository executions,
                                              RecurrenceCalculator recurrence,
                                              TxRunner tx,
                                              Clock clock) {
        return new ScheduleAdminService(schedules, executions, recurrence, tx, clock);
    }

    // --- 스케줄러 등록 (주기는 @Scheduled 가 scanward.scheduler.*-delay-ms 에서 직접 읽음) ---

    @Bean
    @ConditionalOnProperty(prefix = "scanward.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ScanwardSchedulers scanwardSchedulers(ScheduleTickService poller,
                                                 ExecutionSyncService reconciler,
                                                 MaintenanceService maintenance,
                                                 ScanwardProperties props) {
        var sp = props.getScheduler();
        var s = new ScanwardSchedulers(poller, reconciler, maintenance);
        s.setPollBatchSize(sp.getPollBatchSize());
        s.setReconcileBatchSize(sp.getReconcileBatchSize());
        s.setJanitorBatchSize(sp.getJanitorBatchSize());
        s.setRunTimeout(sp.getRunTimeout());
        return s;
    }

    @Bean
    public ScheduleCatalogRegistrar scheduleCatalogRegistrar(ScheduleAdminService admin) {
        return new ScheduleCatalogRegistrar(admin);
    }

    @Bean
    @ConditionalOnProperty(prefix = "scanward.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(ScheduleCatalogRegistrar registrar, ScanwardProperties props) {
        log.debug("catalog: {}", props.getCatalog().getSchedules());
        return args -> registrar.register(props.getCatalog());
    }

    static String resolveInstanceId(String configured) {
        if (configured != null && !configured.isBlank()) return configured;
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("local hostname unavailable ({}), using 'localhost'", e.getMessage());
            host = "localhost";
        }
        return host + ":" + ProcessHandle.current().pid() + ":" + UUID.randomUUID().toString().substring(0, 8);
    }
}
