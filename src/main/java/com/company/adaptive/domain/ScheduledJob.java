package com.company.adaptive.domain;

import com.company.adaptive.domain.enums.JobState;
import com.company.adaptive.scheduled.IntervalSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {
    private String name;
    private IntervalSpec intervalSpec;
    private Instant nextRunAt;
    @ToString.Exclude
    private Runnable action;
    private Instant lastRunAt;
    private String lastError;
    private Instant lastErrorAt;
    @Builder.Default
    private JobState state = JobState.IDLE;
    private long runCount;
    private long failureCount;
}
