package com.example.dataflow.service;

/**
 * Lifecycle of the {@link RefreshJobManager} controller.
 */
public enum SchedulerState {
    IDLE,
    RUNNING,
    STOPPING,
    STOPPED
}
