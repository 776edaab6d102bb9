package com.geico.poc.ttlindex.worker;

/**
 * Outcome of one cleanup pass. A failed pass has already been rolled back.
 */
public final class CleanupResult {

    public enum Status {
        /** Pass committed */
        COMPLETED,
        /** Policy table missing; nothing done */
        SKIPPED,
        /** Pass raised an error and was aborted */
        FAILED
    }

    private final Status status;
    private final long rowsDeleted;
    private final RuntimeException error;

    private CleanupResult(Status status, long rowsDeleted, RuntimeException error) {
        this.status = status;
        this.rowsDeleted = rowsDeleted;
        this.error = error;
    }

    public static CleanupResult completed(long rowsDeleted) {
        return new CleanupResult(Status.COMPLETED, rowsDeleted, null);
    }

    public static CleanupResult skipped() {
        return new CleanupResult(Status.SKIPPED, 0, null);
    }

    public static CleanupResult failed(RuntimeException error) {
        return new CleanupResult(Status.FAILED, 0, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public long getRowsDeleted() {
        return rowsDeleted;
    }

    public RuntimeException getError() {
        return error;
    }

    @Override
    public String toString() {
        if (status == Status.FAILED) {
            return "CleanupResult{FAILED: " + error.getMessage() + "}";
        }
        return "CleanupResult{" + status + ", rowsDeleted=" + rowsDeleted + "}";
    }
}
