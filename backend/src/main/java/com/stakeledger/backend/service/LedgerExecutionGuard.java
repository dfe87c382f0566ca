package com.stakeledger.backend.service;

import com.stakeledger.backend.exception.LedgerException;
import com.stakeledger.backend.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs state-mutating ledger operations one at a time, each in its own transaction.
 * <p>
 * The lock is held until the transaction has committed or rolled back. A mutating call made on a
 * thread that is already inside an operation can only come from an outbound transfer calling
 * back into the ledger; it is rejected with {@link ReentrantCallException}.
 */
@Component
@Slf4j
public class LedgerExecutionGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;
    private final MetricsService metricsService;

    public LedgerExecutionGuard(PlatformTransactionManager transactionManager, MetricsService metricsService) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metricsService = metricsService;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Reentrant ledger call to {} rejected", operation);
            metricsService.recordRejection(operation, "REENTRANT_CALL");
            throw new ReentrantCallException(operation);
        }
        lock.lock();
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (LedgerException ex) {
            log.warn("Ledger {} rejected code={} reason={}", operation, ex.getErrorCode(), ex.getMessage());
            metricsService.recordRejection(operation, ex.getErrorCode().name());
            throw ex;
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    public boolean isExecuting() {
        return lock.isLocked();
    }
}
