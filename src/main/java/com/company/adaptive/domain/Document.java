package com.company.adaptive.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Document implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String content;
    private Map<String, Object> metadata;

    /**
     * Copy whose metadata map can be changed without touching this document.
     */
    public Document copy() {
        return toBuilder()
                .metadata(metadata == null ? null : new HashMap<>(metadata))
                .build();
    }
}
