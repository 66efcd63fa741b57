package com.deepansh.memory.model;

public enum MemoryStatus {
    ACTIVE, SUPERSEDED, ARCHIVED
}
