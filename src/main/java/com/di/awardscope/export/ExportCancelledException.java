package com.di.awardscope.export;

/**
 * An export stopped at a batch boundary because its job was cancelled or the client went away.
 * A clean stop, not a failure; the caller discards the partial output.
 */
public class ExportCancelledException extends RuntimeException {

    private final String jobId;
    private final long rowsEmitted;

    public ExportCancelledException(String jobId, long rowsEmitted, String reason) {
        super("Export " + jobId + " cancelled after " + rowsEmitted + " rows: " + reason);
        this.jobId = jobId;
        this.rowsEmitted = rowsEmitted;
    }

    public ExportCancelledException(String jobId, long rowsEmitted, String reason, Throwable cause) {
        super("Export " + jobId + " cancelled after " + rowsEmitted + " rows: " + reason, cause);
        this.jobId = jobId;
        this.rowsEmitted = rowsEmitted;
    }

    public String getJobId() {
        return jobId;
    }

    public long getRowsEmitted() {
        return rowsEmitted;
    }
}
