package org.carball.designer.model.workload;

public enum OperationType {
    QUERY,
    INSERT,
    UPDATE,
    DELETE;

    public boolean isRead() {
        return this == QUERY;
    }

    public boolean isWrite() {
        return !isRead();
    }
}
