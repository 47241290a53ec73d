package com.di.awardscope.export;

public enum ExportJobState {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
