package com.infomedia.abacox.storemigration.service;

public enum JobState {
    IDLE,        // Nothing run yet
    STARTING,    // Submitted to the executor
    RUNNING,
    COMPLETED,
    STOPPED,     // Ended early on a stop request
    FAILED
}
