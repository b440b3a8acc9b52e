package com.grokpm.backend.modules.maintenance.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.leasing.domain.Unit;
import com.grokpm.backend.modules.leasing.infrastructure.persistence.UnitRepository;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceStatus;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceTicket;
import com.grokpm.backend.modules.maintenance.infrastructure.persistence.MaintenanceTicketRepository;
import com.grokpm.backend.modules.maintenance.presentation.dto.CreateMaintenanceTicketRequest;
import com.grokpm.backend.modules.maintenance.presentation.dto.MaintenanceDtoMapper;
import com.grokpm.backend.modules.maintenance.presentation.dto.MaintenanceTicketResponse;
import com.grokpm.backend.modules.maintenance.presentation.dto.UpdateMaintenanceTicketRequest;

/**
 * Maintenance requests raised against a unit. Status changes go through
 * {@link MaintenanceTicket#transitionTo(MaintenanceStatus, OffsetDateTime)} so {@code resolvedAt} always matches the
 * current status.
 */
@Service
@Transactional
public class MaintenanceTicketService {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceTicketService.class);

    private final MaintenanceTicketRepository maintenanceTicketRepository;
    private final UnitRepository unitRepository;
    private final Clock clock;

    public MaintenanceTicketService(
            MaintenanceTicketRepository maintenanceTicketRepository,
            UnitRepository unitRepository,
            Clock clock
    ) {
        this.maintenanceTicketRepository = maintenanceTicketRepository;
        this.unitRepository = unitRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<MaintenanceTicketResponse> getTickets(Long unitId, MaintenanceStatus status) {
        return maintenanceTicketRepository.search(unitId, status).stream()
                .map(MaintenanceDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public MaintenanceTicketResponse getTicket(Long ticketId) {
        return MaintenanceDtoMapper.toResponse(loadTicket(ticketId));
    }

    public MaintenanceTicketResponse createTicket(CreateMaintenanceTicketRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        MaintenanceTicket ticket = new MaintenanceTicket();
        ticket.setUnit(resolveUnit(request.unitId()));
        ticket.setTitle(request.title().trim());
        ticket.setDescription(request.description());
        if (request.priority() != null) {
            ticket.setPriority(request.priority());
        }
        ticket.setReportedAt(now);
        ticket.transitionTo(request.status(), now);
        MaintenanceTicket saved = maintenanceTicketRepository.saveAndFlush(ticket);
        log.info("Opened maintenance ticket {} for unit {} ({})", saved.getId(), request.unitId(), saved.getPriority());
        return MaintenanceDtoMapper.toResponse(saved);
    }

    public MaintenanceTicketResponse updateTicket(Long ticketId, UpdateMaintenanceTicketRequest request) {
        MaintenanceTicket ticket = loadTicket(ticketId);
        if (request.unitId() != null) {
            ticket.setUnit(resolveUnit(request.unitId()));
        }
        if (request.title() != null) {
            ticket.setTitle(request.title().trim());
        }
        if (request.description() != null) {
            ticket.setDescription(request.description());
        }
        if (request.priority() != null) {
            ticket.setPriority(request.priority());
        }
        ticket.transitionTo(request.status(), OffsetDateTime.now(clock));
        return MaintenanceDtoMapper.toResponse(maintenanceTicketRepository.saveAndFlush(ticket));
    }

    public void deleteTicket(Long ticketId) {
        MaintenanceTicket ticket = loadTicket(ticketId);
        ticket.getUnit().getMaintenanceTickets().remove(ticket);
        maintenanceTicketRepository.delete(ticket);
    }

    private MaintenanceTicket loadTicket(Long ticketId) {
        return maintenanceTicketRepository.findById(ticketId)
                .orElseThrow(() -> ProblemException.notFound("MaintenanceTicket", ticketId));
    }

    private Unit resolveUnit(Long unitId) {
        return unitRepository.findById(unitId)
                .orElseThrow(() -> ProblemException.invalidReference("unitId", unitId));
    }
}
