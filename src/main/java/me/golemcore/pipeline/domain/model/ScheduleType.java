package me.golemcore.pipeline.domain.model;

public enum ScheduleType {
    CRON, INTERVAL, MANUAL
}
