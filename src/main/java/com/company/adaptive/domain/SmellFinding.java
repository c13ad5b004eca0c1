package com.company.adaptive.domain;

import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.domain.enums.Severity;
import com.company.adaptive.domain.enums.SmellType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmellFinding {
    private SmellType type;
    private Severity severity;
    private String scope;
    private String pattern;
    private OperationKind operationKind;
    private String collection;
    private String description;
    private String suggestion;
    private Instant detectedAt;
}
