package com.grokpm.backend.modules.maintenance.presentation.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import com.grokpm.backend.modules.maintenance.domain.MaintenancePriority;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceStatus;

public record UpdateMaintenanceTicketRequest(
        Long unitId,
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") @Size(max = 200) String title,
        @Size(max = 2000) String description,
        MaintenancePriority priority,
        MaintenanceStatus status
) {
}
