package com.rms.taskqueue.consumer;

public enum ConsumerState {
    NOT_RUNNING,
    RUNNING,
    STOPPING,
    STOPPED
}
