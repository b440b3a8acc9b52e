package com.grokpm.backend.modules.maintenance.presentation.dto;

import com.grokpm.backend.modules.leasing.presentation.dto.LeasingDtoMapper;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceTicket;

public final class MaintenanceDtoMapper {

    private MaintenanceDtoMapper() {
    }

    public static MaintenanceTicketResponse toResponse(MaintenanceTicket ticket) {
        return new MaintenanceTicketResponse(
                ticket.getId(),
                ticket.getTitle(),
                ticket.getDescription(),
                ticket.getPriority(),
                ticket.getStatus(),
                ticket.getReportedAt(),
                ticket.getResolvedAt(),
                LeasingDtoMapper.toUnitSummary(ticket.getUnit()),
                ticket.getCreatedAt(),
                ticket.getUpdatedAt()
        );
    }
}
