package com.architecture.memory.palace.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for memory recall
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemorySearchResponse {

    private List<MemoryHit> hits;
    private int resultCount;
    private int page;
    private int pageSize;
    private long processingTimeMs;
}
