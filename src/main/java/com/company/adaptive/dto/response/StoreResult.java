package com.company.adaptive.dto.response;

import com.company.adaptive.domain.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private String collection;
    private List<Document> documents;
    private int affected;
    private boolean cached;

    /**
     * Detached copy: a fresh document list holding copied documents.
     */
    public StoreResult copy(boolean cachedFlag) {
        return StoreResult.builder()
                .collection(collection)
                .documents(documents == null ? null : documents.stream().map(Document::copy).toList())
                .affected(affected)
                .cached(cachedFlag)
                .build();
    }
}
