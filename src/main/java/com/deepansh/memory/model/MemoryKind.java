package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum MemoryKind {
    ENTITY, FACT, PREFERENCE, EVENT, GOAL, PROCEDURE, DECISION, ACTION;

    /** Lenient parse for collaborator output; unknown values fall back to FACT. */
    @JsonCreator
    public static MemoryKind from(String value) {
        if (value == null || value.isBlank()) return FACT;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return FACT;
        }
    }
}
