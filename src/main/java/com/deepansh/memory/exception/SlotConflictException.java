package com.deepansh.memory.exception;

import lombok.Getter;

/**
 * Another writer changed the slot (or the record) between read and write.
 * The engine retries with a fresh read.
 */
@Getter
public class SlotConflictException extends MemoryException {

    private final String slotKey;

    public SlotConflictException(String slotKey, String message) {
        super(message);
        this.slotKey = slotKey;
    }

    public SlotConflictException(String slotKey, String message, Throwable cause) {
        super(message, cause);
        this.slotKey = slotKey;
    }
}
