package com.deepansh.memory.exception;

public class RecordNotFoundException extends MemoryException {

    public RecordNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
