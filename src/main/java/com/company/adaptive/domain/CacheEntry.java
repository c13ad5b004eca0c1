package com.company.adaptive.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A cached result. Owned by the result cache and only mutated under its lock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {
    private String scope;
    private String key;
    private Object value;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant lastAccessedAt;
    private long accessCount;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Object access(Instant now) {
        accessCount++;
        lastAccessedAt = now;
        return value;
    }
}
