package com.grokpm.backend.modules.association.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.association.application.AssociationService;
import com.grokpm.backend.modules.association.presentation.dto.CreateAssociationRequest;
import com.grokpm.backend.modules.association.presentation.dto.AssociationResponse;
import com.grokpm.backend.modules.association.presentation.dto.UpdateAssociationRequest;

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
@RequestMapping("/api/associations")
public class AssociationController {

    private final AssociationService associationService;

    public AssociationController(AssociationService associationService) {
        this.associationService = associationService;
    }

    @GetMapping
    public ResponseEntity<List<AssociationResponse>> getAssociations(
            @RequestParam(name = "propertyId", required = false) Long propertyId
    ) {
        return ResponseEntity.ok(associationService.getAssociations(propertyId));
    }

    @GetMapping("/{associationId}")
    public ResponseEntity<AssociationResponse> getAssociation(@PathVariable("associationId") Long associationId) {
        return ResponseEntity.ok(associationService.getAssociation(associationId));
    }

    @PostMapping
    public ResponseEntity<AssociationResponse> createAssociation(@Valid @RequestBody CreateAssociationRequest request) {
        AssociationResponse response = associationService.createAssociation(request);
        return ResponseEntity.created(URI.create("/api/associations/" + response.id())).body(response);
    }

    @PutMapping("/{associationId}")
    public ResponseEntity<AssociationResponse> updateAssociation(
            @PathVariable("associationId") Long associationId,
            @Valid @RequestBody UpdateAssociationRequest request
    ) {
        return ResponseEntity.ok(associationService.updateAssociation(associationId, request));
    }

    @DeleteMapping("/{associationId}")
    public ResponseEntity<Void> deleteAssociation(@PathVariable("associationId") Long associationId) {
        associationService.deleteAssociation(associationId);
        return ResponseEntity.noContent().build();
    }
}
