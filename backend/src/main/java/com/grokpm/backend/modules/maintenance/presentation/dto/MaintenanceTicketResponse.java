package com.grokpm.backend.modules.maintenance.presentation.dto;

import java.time.OffsetDateTime;

import com.grokpm.backend.modules.leasing.presentation.dto.UnitSummary;
import com.grokpm.backend.modules.maintenance.domain.MaintenancePriority;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceStatus;

public record MaintenanceTicketResponse(
        Long id,
        String title,
        String description,
        MaintenancePriority priority,
        MaintenanceStatus status,
        OffsetDateTime reportedAt,
        OffsetDateTime resolvedAt,
        UnitSummary unit,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
