package net.scanward.integration.spring;

import net.scanward.adapter.jdbc.repo.JdbcRunRepository;
import net.scanward.adapter.jdbc.repo.JdbcScheduleExecutionRepository;
import net.scanward.adapter.jdbc.repo.JdbcScheduleRepository;
import net.scanward.core.spi.*;
import net.scanward.integration.spring.run.StoreRunStatusClient;
import net.scanward.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class ScanwardSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // 저장소 구현 (adapter-jdbc)
    @Bean public ScheduleRepository scheduleRepository() { return new JdbcScheduleRepository(); }
    @Bean public ScheduleExecutionRepository scheduleExecutionRepository() { return new JdbcScheduleExecutionRepository(); }
    @Bean public RunRepository runRepository() { return new JdbcRunRepository(); }

    @Bean
    public RunStatusClient runStatusClient(RunRepository runs, TxRunner tx) {
        return new StoreRunStatusClient(runs, tx);
    }

    @Bean public Clock systemClock() { return java.time.Instant::now; }
}
