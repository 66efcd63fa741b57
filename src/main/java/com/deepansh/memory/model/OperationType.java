package com.deepansh.memory.model;

public enum OperationType {
    ADD, UPDATE, DELETE, NOOP, CONSOLIDATE
}
