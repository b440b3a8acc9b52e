package com.grokpm.backend.modules.leasing.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.leasing.application.TenantService;
import com.grokpm.backend.modules.leasing.presentation.dto.CreateTenantRequest;
import com.grokpm.backend.modules.leasing.presentation.dto.TenantResponse;
import com.grokpm.backend.modules.leasing.presentation.dto.UpdateTenantRequest;

import jakarta.validation.Valid;

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
@RequestMapping("/api/tenants")
public class TenantController {

    private final TenantService tenantService;

    public TenantController(TenantService tenantService) {
        this.tenantService = tenantService;
    }

    @GetMapping
    public ResponseEntity<List<TenantResponse>> getTenants(
            @RequestParam(name = "unitId", required = false) Long unitId
    ) {
        return ResponseEntity.ok(tenantService.getTenants(unitId));
    }

    @GetMapping("/{tenantId}")
    public ResponseEntity<TenantResponse> getTenant(@PathVariable("tenantId") Long tenantId) {
        return ResponseEntity.ok(tenantService.getTenant(tenantId));
    }

    @PostMapping
    public ResponseEntity<TenantResponse> createTenant(@Valid @RequestBody CreateTenantRequest request) {
        TenantResponse response = tenantService.createTenant(request);
        return ResponseEntity.created(URI.create("/api/tenants/" + response.id())).body(response);
    }

    @PutMapping("/{tenantId}")
    public ResponseEntity<TenantResponse> updateTenant(
            @PathVariable("tenantId") Long tenantId,
            @Valid @RequestBody UpdateTenantRequest request
    ) {
        return ResponseEntity.ok(tenantService.updateTenant(tenantId, request));
    }

    @DeleteMapping("/{tenantId}")
    public ResponseEntity<Void> deleteTenant(@PathVariable("tenantId") Long tenantId) {
        tenantService.deleteTenant(tenantId);
        return ResponseEntity.noContent().build();
    }
}
