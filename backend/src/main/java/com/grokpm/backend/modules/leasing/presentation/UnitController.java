package com.grokpm.backend.modules.leasing.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.leasing.application.UnitService;
import com.grokpm.backend.modules.leasing.presentation.dto.CreateUnitRequest;
import com.grokpm.backend.modules.leasing.presentation.dto.UnitResponse;
import com.grokpm.backend.modules.leasing.presentation.dto.UpdateUnitRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
@RequestMapping("/api/units")
public class UnitController {

    private final UnitService unitService;

    public UnitController(UnitService unitService) {
        this.unitService = unitService;
    }

    @GetMapping
    public ResponseEntity<List<UnitResponse>> getUnits(
            @RequestParam(name = "propertyId", required = false) Long propertyId,
            @RequestParam(name = "addressId", required = false) Long addressId,
            @RequestParam(name = "status", required = false) String status
    ) {
        return ResponseEntity.ok(unitService.getUnits(propertyId, addressId, status));
    }

    @GetMapping("/{unitId}")
    public ResponseEntity<UnitResponse> getUnit(@PathVariable("unitId") Long unitId) {
        return ResponseEntity.ok(unitService.getUnit(unitId));
    }

    @Operation(summary = "Create a unit under an existing address")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Unit created"),
            @ApiResponse(responseCode = "400", description = "Validation failure or unknown addressId (INVALID_REFERENCE)")
    })
    @PostMapping
    public ResponseEntity<UnitResponse> createUnit(@Valid @RequestBody CreateUnitRequest request) {
        UnitResponse response = unitService.createUnit(request);
        return ResponseEntity.created(URI.create("/api/units/" + response.id())).body(response);
    }

    @PutMapping("/{unitId}")
    public ResponseEntity<UnitResponse> updateUnit(
            @PathVariable("unitId") Long unitId,
            @Valid @RequestBody UpdateUnitRequest request
    ) {
        return ResponseEntity.ok(unitService.updateUnit(unitId, request));
    }

    @Operation(summary = "Delete a unit with its tenants, payments, photos and maintenance tickets")
    @DeleteMapping("/{unitId}")
    public ResponseEntity<Void> deleteUnit(@PathVariable("unitId") Long unitId) {
        unitService.deleteUnit(unitId);
        return ResponseEntity.noContent().build();
    }
}
