package com.company.adaptive.dto.response;

import com.company.adaptive.domain.SmellFinding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmellReport {
    private String scope;
    private int totalSmells;
    private Map<String, Long> byType;
    private Map<String, Long> bySeverity;
    private List<SmellFinding> thrashing;
    private List<SmellFinding> recent;
}
