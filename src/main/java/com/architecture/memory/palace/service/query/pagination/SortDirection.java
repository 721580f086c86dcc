package com.architecture.memory.palace.service.query.pagination;

public enum SortDirection {
    ASC,
    DESC
}
