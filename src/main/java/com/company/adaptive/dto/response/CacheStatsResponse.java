package com.company.adaptive.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatsResponse {
    private String scope;
    private int totalEntries;
    private int expiredEntries;
    private int activeEntries;
    private long totalAccesses;
    private long hits;
    private long misses;
    private long evictions;
    private long expirations;
    private int maxEntries;
    private long defaultTtlSeconds;
}
