package com.grokpm.backend.modules.maintenance.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import com.grokpm.backend.modules.maintenance.domain.MaintenancePriority;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceStatus;

public record CreateMaintenanceTicketRequest(
        @NotNull Long unitId,
        @NotBlank @Size(max = 200) String title,
        @Size(max = 2000) String description,
        MaintenancePriority priority,
        MaintenanceStatus status
) {
}
