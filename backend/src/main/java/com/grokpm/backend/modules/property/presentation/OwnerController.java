package com.grokpm.backend.modules.property.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.property.application.OwnerService;
import com.grokpm.backend.modules.property.presentation.dto.CreateOwnerRequest;
import com.grokpm.backend.modules.property.presentation.dto.OwnerResponse;
import com.grokpm.backend.modules.property.presentation.dto.UpdateOwnerRequest;

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
@RequestMapping("/api/owners")
public class OwnerController {

    private final OwnerService ownerService;

    public OwnerController(OwnerService ownerService) {
        this.ownerService = ownerService;
    }

    @GetMapping
    public ResponseEntity<List<OwnerResponse>> getOwners(
            @RequestParam(name = "propertyId", required = false) Long propertyId
    ) {
        return ResponseEntity.ok(ownerService.getOwners(propertyId));
    }

    @GetMapping("/{ownerId}")
    public ResponseEntity<OwnerResponse> getOwner(@PathVariable("ownerId") Long ownerId) {
        return ResponseEntity.ok(ownerService.getOwner(ownerId));
    }

    @PostMapping
    public ResponseEntity<OwnerResponse> createOwner(@Valid @RequestBody CreateOwnerRequest request) {
        OwnerResponse response = ownerService.createOwner(request);
        return ResponseEntity.created(URI.create("/api/owners/" + response.id())).body(response);
    }

    @PutMapping("/{ownerId}")
    public ResponseEntity<OwnerResponse> updateOwner(
            @PathVariable("ownerId") Long ownerId,
            @Valid @RequestBody UpdateOwnerRequest request
    ) {
        return ResponseEntity.ok(ownerService.updateOwner(ownerId, request));
    }

    @DeleteMapping("/{ownerId}")
    public ResponseEntity<Void> deleteOwner(@PathVariable("ownerId") Long ownerId) {
        ownerService.deleteOwner(ownerId);
        return ResponseEntity.noContent().build();
    }
}
