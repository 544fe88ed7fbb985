package com.syncbridge.engine.support;

import com.syncbridge.core.exception.TransientIOException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Classifies failures of the stream and the stores as transient (worth a local retry) or not.
 */
public final class TransientFailures {

    private TransientFailures() {
    }

    public static boolean isTransient(Throwable failure) {
        return failure instanceof TransientIOException
            || failure instanceof TransientDataAccessException
            || failure instanceof RecoverableDataAccessException
            || failure instanceof DataAccessResourceFailureException
            || failure instanceof CannotCreateTransactionException;
    }

    /**
     * Sleep for a backoff, restoring the interrupt flag if interrupted.
     *
     * @return false if the thread was interrupted
     */
    public static boolean pause(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
