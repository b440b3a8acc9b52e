package com.grokpm.backend.modules.maintenance.domain;

public enum MaintenanceStatus {
    OPEN,
    IN_PROGRESS,
    RESOLVED,
    CLOSED;

    public boolean isFinished() {
        return this == RESOLVED || this == CLOSED;
    }
}
