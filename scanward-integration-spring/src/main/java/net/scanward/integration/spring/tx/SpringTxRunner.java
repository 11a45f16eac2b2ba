package net.scanward.integration.spring.tx;

import net.scanward.adapter.jdbc.TxContext;
import net.scanward.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 매니저 위에서 도는 TxRunner.
 * 트랜잭션에 묶인 물리 커넥션을 TxContext 에 꽂아 JDBC 어댑터가 그대로 쓰게 한다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;
    private final int timeoutSeconds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this(tm, ds, null);
    }

    /** @param timeout 트랜잭션 타임아웃. null 이면 매니저 기본값 */
    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds, Duration timeout) {
        this.tm = tm;
        this.ds = ds;
        this.timeoutSeconds = timeout == null ? TransactionDefinition.TIMEOUT_DEFAULT : (int) timeout.toSeconds();
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        tpl.setTimeout(timeoutSeconds);

        try {
            return tpl.execute(status -> {
                Connection outer = TxContext.get();
                // REQUIRED 로 참여 중이면 바깥 커넥션 그대로
                if (outer != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
                    return call(body);
                }

                // 새 트랜잭션의 물리 커넥션. 끝나면 바깥 것을 되돌린다
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    if (outer != null) TxContext.set(outer);
                    else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedBodyException e) {
            throw e.getCause();
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        }
    }

    /** TransactionTemplate 을 통과시키기 위한 포장. 롤백 후 원래 예외로 풀어 던진다 */
    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) { super(cause); }

        @Override public synchronized Exception getCause() { return (Exception) super.getCause(); }
    }
}
