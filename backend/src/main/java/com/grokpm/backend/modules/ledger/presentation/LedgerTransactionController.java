package com.grokpm.backend.modules.ledger.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.ledger.application.LedgerTransactionService;
import com.grokpm.backend.modules.ledger.presentation.dto.CreateTransactionRequest;
import com.grokpm.backend.modules.ledger.presentation.dto.TransactionResponse;
import com.grokpm.backend.modules.ledger.presentation.dto.UpdateTransactionRequest;

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
@RequestMapping("/api/transactions")
public class LedgerTransactionController {

    private final LedgerTransactionService ledgerTransactionService;

    public LedgerTransactionController(LedgerTransactionService ledgerTransactionService) {
        this.ledgerTransactionService = ledgerTransactionService;
    }

    @GetMapping
    public ResponseEntity<List<TransactionResponse>> getTransactions(
            @RequestParam(name = "propertyId", required = false) Long propertyId,
            @RequestParam(name = "accountId", required = false) Long accountId
    ) {
        return ResponseEntity.ok(ledgerTransactionService.getTransactions(propertyId, accountId));
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("transactionId") Long transactionId) {
        return ResponseEntity.ok(ledgerTransactionService.getTransaction(transactionId));
    }

    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(@Valid @RequestBody CreateTransactionRequest request) {
        TransactionResponse response = ledgerTransactionService.createTransaction(request);
        return ResponseEntity.created(URI.create("/api/transactions/" + response.id())).body(response);
    }

    @PutMapping("/{transactionId}")
    public ResponseEntity<TransactionResponse> updateTransaction(
            @PathVariable("transactionId") Long transactionId,
            @Valid @RequestBody UpdateTransactionRequest request
    ) {
        return ResponseEntity.ok(ledgerTransactionService.updateTransaction(transactionId, request));
    }

    @DeleteMapping("/{transactionId}")
    public ResponseEntity<Void> deleteTransaction(@PathVariable("transactionId") Long transactionId) {
        ledgerTransactionService.deleteTransaction(transactionId);
        return ResponseEntity.noContent().build();
    }
}
