package com.company.adaptive.event;

import com.company.adaptive.domain.enums.OperationKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DocumentsChangedEvent {
    private final String scope;
    private final String collection;
    private final OperationKind kind;
    private final int affected;
}
