package com.grokpm.backend.modules.maintenance.domain;

public enum MaintenancePriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
