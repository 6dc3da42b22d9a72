package com.runeledger.service;

import com.runeledger.config.RuneLedgerProperties;
import com.runeledger.web.GameStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs one mutating operation per transaction and replays it on serialization failures,
 * deadlocks and lock timeouts. Calls made inside an already active transaction join it
 * without retrying; the outermost caller owns the retry.
 */
@Component
public class TransactionRetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionRetryExecutor.class);

    private final TransactionTemplate transactionTemplate;
    private final RuneLedgerProperties runeLedgerProperties;

    public TransactionRetryExecutor(
            PlatformTransactionManager transactionManager,
            RuneLedgerProperties runeLedgerProperties
    ) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.runeLedgerProperties = runeLedgerProperties;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        return execute(operation, work, List.of());
    }

    public <T> T execute(
            String operation,
            Supplier<T> work,
            List<Class<? extends RuntimeException>> additionalRetryable
    ) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }

        int maxAttempts = Math.max(1, runeLedgerProperties.getTransaction().getMaxAttempts());
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (RuntimeException ex) {
                if (!isRetryable(ex, additionalRetryable)) {
                    throw ex;
                }
                lastFailure = ex;
                log.warn(
                        "{} conflicted on attempt {}/{}: {}",
                        operation,
                        attempt,
                        maxAttempts,
                        ex.getMessage()
                );
                if (attempt < maxAttempts) {
                    pause(operation, attempt);
                }
            }
        }
        throw GameStateException.concurrencyConflict(
                operation + " could not commit after " + maxAttempts + " attempts",
                lastFailure
        );
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    private static boolean isRetryable(RuntimeException ex, List<Class<? extends RuntimeException>> additionalRetryable) {
        if (ex instanceof ConcurrencyFailureException) {
            return true;
        }
        for (Class<? extends RuntimeException> type : additionalRetryable) {
            if (type.isInstance(ex)) {
                return true;
            }
        }
        return false;
    }

    private void pause(String operation, int attempt) {
        long backoffMs = runeLedgerProperties.getTransaction().getRetryBackoffMs() * attempt;
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GameStateException.concurrencyConflict(operation + " was interrupted while backing off", e);
        }
    }
}
