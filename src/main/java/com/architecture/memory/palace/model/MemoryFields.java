package com.architecture.memory.palace.model;

/**
 * Property keys on memory nodes that queries depend on.
 */
public final class MemoryFields {

    public static final String ID = "id";
    public static final String CONTENT = "content";
    public static final String EMBEDDING = "embedding";
    public static final String TIMESTAMP = "timestamp";
    public static final String LAST_ACCESSED = "last_accessed";
    public static final String ACCESS_COUNT = "access_count";

    private MemoryFields() {
    }
}
