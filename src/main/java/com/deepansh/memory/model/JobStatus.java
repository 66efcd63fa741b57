package com.deepansh.memory.model;

public enum JobStatus {
    PENDING, RUNNING, DONE, FAILED
}
