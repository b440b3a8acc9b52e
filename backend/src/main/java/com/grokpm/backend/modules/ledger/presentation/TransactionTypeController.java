package com.grokpm.backend.modules.ledger.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.ledger.application.TransactionTypeService;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerTypeRequest;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerTypeResponse;

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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transaction-types")
public class TransactionTypeController {

    private final TransactionTypeService transactionTypeService;

    public TransactionTypeController(TransactionTypeService transactionTypeService) {
        this.transactionTypeService = transactionTypeService;
    }

    @GetMapping
    public ResponseEntity<List<LedgerTypeResponse>> getTransactionTypes() {
        return ResponseEntity.ok(transactionTypeService.getTransactionTypes());
    }

    @GetMapping("/{transactionTypeId}")
    public ResponseEntity<LedgerTypeResponse> getTransactionType(@PathVariable("transactionTypeId") Long transactionTypeId) {
        return ResponseEntity.ok(transactionTypeService.getTransactionType(transactionTypeId));
    }

    @PostMapping
    public ResponseEntity<LedgerTypeResponse> createTransactionType(@Valid @RequestBody LedgerTypeRequest request) {
        LedgerTypeResponse response = transactionTypeService.createTransactionType(request);
        return ResponseEntity.created(URI.create("/api/transaction-types/" + response.id())).body(response);
    }

    @PutMapping("/{transactionTypeId}")
    public ResponseEntity<LedgerTypeResponse> updateTransactionType(
            @PathVariable("transactionTypeId") Long transactionTypeId,
            @Valid @RequestBody LedgerTypeRequest request
    ) {
        return ResponseEntity.ok(transactionTypeService.updateTransactionType(transactionTypeId, request));
    }

    @Operation(summary = "Delete a transaction type that no transaction uses")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "409", description = "Still referenced (RESOURCE_IN_USE)")
    })
    @DeleteMapping("/{transactionTypeId}")
    public ResponseEntity<Void> deleteTransactionType(@PathVariable("transactionTypeId") Long transactionTypeId) {
        transactionTypeService.deleteTransactionType(transactionTypeId);
        return ResponseEntity.noContent().build();
    }
}
