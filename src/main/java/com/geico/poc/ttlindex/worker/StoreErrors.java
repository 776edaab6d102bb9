package com.geico.poc.ttlindex.worker;

import java.sql.SQLException;

/**
 * SQLState classification of failures raised by a worker's store session.
 */
public final class StoreErrors {

    /** admin_shutdown: the backend was terminated, e.g. by pg_terminate_backend */
    static final String ADMIN_SHUTDOWN = "57P01";

    /** connection_exception class */
    static final String CONNECTION_EXCEPTION_CLASS = "08";

    private StoreErrors() {
    }

    /**
     * The session's backend was terminated on request; the worker should stop.
     */
    public static boolean isTerminationRequest(Throwable error) {
        String sqlState = sqlState(error);
        return ADMIN_SHUTDOWN.equals(sqlState);
    }

    /**
     * The session itself is unusable; nothing in-process can recover it.
     */
    public static boolean isSessionLost(Throwable error) {
        String sqlState = sqlState(error);
        return sqlState != null && sqlState.startsWith(CONNECTION_EXCEPTION_CLASS);
    }

    /**
     * First SQLState found walking the cause chain (and SQLException next-exception chains).
     */
    public static String sqlState(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 32) {
            if (current instanceof SQLException) {
                SQLException sql = (SQLException) current;
                for (SQLException next = sql; next != null; next = next.getNextException()) {
                    if (next.getSQLState() != null) {
                        return next.getSQLState();
                    }
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
