package com.company.adaptive.dto.response;

import com.company.adaptive.domain.enums.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSnapshot {
    private String name;
    private String intervalSpec;
    private JobState state;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private String lastError;
    private Instant lastErrorAt;
    private long runCount;
    private long failureCount;
}
