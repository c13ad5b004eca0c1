package com.company.adaptive.domain.enums;

public enum SmellType {
    THRASHING("Identical operation repeated in rapid succession",
            "Cache the result or batch the callers"),
    EXCESSIVE_RESULTS("Query requests an unusually large result set",
            "Consider paginating results or reducing the result limit"),
    LARGE_BATCH("Insert carries a very large batch of documents",
            "Consider batching into smaller groups (e.g., 500 documents)"),
    COMPLEX_FILTER("Metadata filter is unusually complex",
            "Consider simplifying filters or using indexed fields");

    private final String description;
    private final String suggestion;

    SmellType(String description, String suggestion) {
        this.description = description;
        this.suggestion = suggestion;
    }

    public String getDescription() {
        return description;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
