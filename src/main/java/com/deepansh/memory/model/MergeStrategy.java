package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum MergeStrategy {
    /** Existing content is wrong; overwrite in place. */
    REPLACE,
    /** Existing content gains detail; concatenate in place. */
    APPEND,
    /** True state change; new active record, old one kept as history. */
    SUPERSEDE;

    @JsonCreator
    public static MergeStrategy from(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
