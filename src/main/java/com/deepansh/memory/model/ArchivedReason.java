package com.deepansh.memory.model;

public enum ArchivedReason {
    DELETED, EXPIRED, UNUSED, CONSOLIDATED
}
