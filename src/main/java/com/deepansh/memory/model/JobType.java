package com.deepansh.memory.model;

public enum JobType {
    DECAY, CONSOLIDATE, RESUMMARIZE, REINDEX, CLEANUP
}
