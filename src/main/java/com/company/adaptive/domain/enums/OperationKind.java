package com.company.adaptive.domain.enums;

public enum OperationKind {
    QUERY(true),
    INSERT(false),
    UPDATE(false),
    DELETE(false);

    private final boolean read;

    OperationKind(boolean read) {
        this.read = read;
    }

    public boolean isRead() {
        return read;
    }

    public String tagValue() {
        return name().toLowerCase();
    }
}
