package com.yerin.submitflow.domain;

public enum WorkerStatus {
    STARTING,
    IDLE,
    RUNNING,
    DEAD
}
