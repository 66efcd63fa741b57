package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * PRIVATE records never leave the owner's record tier: they are excluded
 * from category summaries, exports and default retrieval.
 */
public enum Sensitivity {
    NORMAL, SENSITIVE, PRIVATE;

    @JsonCreator
    public static Sensitivity from(String value) {
        if (value == null || value.isBlank()) return NORMAL;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
