package com.grokpm.backend.modules.maintenance.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.maintenance.application.MaintenanceTicketService;
import com.grokpm.backend.modules.maintenance.domain.MaintenanceStatus;
import com.grokpm.backend.modules.maintenance.presentation.dto.CreateMaintenanceTicketRequest;
import com.grokpm.backend.modules.maintenance.presentation.dto.MaintenanceTicketResponse;
import com.grokpm.backend.modules.maintenance.presentation.dto.UpdateMaintenanceTicketRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/maintenance")
public class MaintenanceTicketController {

    private final MaintenanceTicketService maintenanceTicketService;

    public MaintenanceTicketController(MaintenanceTicketService maintenanceTicketService) {
        this.maintenanceTicketService = maintenanceTicketService;
    }

    @GetMapping
    public ResponseEntity<List<MaintenanceTicketResponse>> getTickets(
            @RequestParam(name = "unitId", required = false) Long unitId,
            @RequestParam(name = "status", required = false) MaintenanceStatus status
    ) {
        return ResponseEntity.ok(maintenanceTicketService.getTickets(unitId, status));
    }

    @GetMapping("/{ticketId}")
    public ResponseEntity<MaintenanceTicketResponse> getTicket(@PathVariable("ticketId") Long ticketId) {
        return ResponseEntity.ok(maintenanceTicketService.getTicket(ticketId));
    }

    @Operation(
            summary = "Open a maintenance ticket",
            description = "Priority defaults to MEDIUM and status to OPEN. reportedAt is set by the server."
    )
    @PostMapping
    public ResponseEntity<MaintenanceTicketResponse> createTicket(
            @Valid @RequestBody CreateMaintenanceTicketRequest request
    ) {
        MaintenanceTicketResponse response = maintenanceTicketService.createTicket(request);
        return ResponseEntity.created(URI.create("/api/maintenance/" + response.id())).body(response);
    }

    @Operation(
            summary = "Update a maintenance ticket",
            description = "Moving to RESOLVED or CLOSED stamps resolvedAt; moving back to OPEN or IN_PROGRESS clears it."
    )
    @PutMapping("/{ticketId}")
    public ResponseEntity<MaintenanceTicketResponse> updateTicket(
            @PathVariable("ticketId") Long ticketId,
            @Valid @RequestBody UpdateMaintenanceTicketRequest request
    ) {
        return ResponseEntity.ok(maintenanceTicketService.updateTicket(ticketId, request));
    }

    @DeleteMapping("/{ticketId}")
    public ResponseEntity<Void> deleteTicket(@PathVariable("ticketId") Long ticketId) {
        maintenanceTicketService.deleteTicket(ticketId);
        return ResponseEntity.noContent().build();
    }
}
