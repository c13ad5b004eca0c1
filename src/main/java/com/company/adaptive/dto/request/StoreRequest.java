package com.company.adaptive.dto.request;

import com.company.adaptive.domain.Document;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Arguments of a store operation. Which fields apply depends on the operation:
 * queries use ids/where/text/limit, inserts and updates carry documents,
 * deletes use ids or where.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreRequest {
    private List<String> ids;

    private Map<String, Object> where;

    private String text;

    @Min(1)
    @Max(10000)
    private Integer limit;

    @Valid
    private List<Document> documents;

    // seconds; null uses the cache default
    @Min(1)
    private Long ttlSeconds;
}
