package me.golemcore.pipeline.domain.model;

public enum ExecutionStatus {

    RUNNING, COMPLETED, FAILED, SKIPPED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
