package com.company.adaptive.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScopeSummary {
    private String scope;
    private int activeTrails;
    private long totalHits;
    private Map<String, Long> hitsByOperation;
    private Map<String, Long> hitsByCollection;
}
