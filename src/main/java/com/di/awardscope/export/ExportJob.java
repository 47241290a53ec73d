package com.di.awardscope.export;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one running export. The streaming thread writes progress; status polls and cancel
 * requests read and flip it from other threads.
 */
public class ExportJob {

    private final String id;
    private final Instant createdAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicLong rowsEmitted = new AtomicLong();
    private final AtomicReference<ExportJobState> state = new AtomicReference<>(ExportJobState.RUNNING);
    private volatile long estimatedRows = -1;
    private volatile Instant finishedAt;
    private volatile String error;

    public ExportJob(String id) {
        this.id = id;
        this.createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public ExportJobState getState() {
        return state.get();
    }

    public long getRowsEmitted() {
        return rowsEmitted.get();
    }

    public long getEstimatedRows() {
        return estimatedRows;
    }

    public void setEstimatedRows(long estimatedRows) {
        this.estimatedRows = estimatedRows;
    }

    /** Rows only ever increase. */
    void advance(long rows) {
        rowsEmitted.addAndGet(rows);
    }

    /** Requests cancellation; takes effect at the next batch boundary. */
    public boolean cancel() {
        return !state.get().isFinished() && cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void complete() {
        finish(ExportJobState.COMPLETED, null);
    }

    void cancelled() {
        cancelRequested.set(true);
        finish(ExportJobState.CANCELLED, null);
    }

    void failed(String message) {
        finish(ExportJobState.FAILED, message);
    }

    private void finish(ExportJobState target, String message) {
        if (state.compareAndSet(ExportJobState.RUNNING, target)) {
            this.error = message;
            this.finishedAt = Instant.now();
        }
    }

    public ExportJobStatus status() {
        return new ExportJobStatus(id, state.get(), rowsEmitted.get(), estimatedRows,
                ExportProgressListener.fraction(rowsEmitted.get(), estimatedRows), createdAt, finishedAt, error);
    }
}
