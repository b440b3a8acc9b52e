package com.grokpm.backend.modules.ledger.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.ledger.application.AccountTypeService;
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
@RequestMapping("/api/account-types")
public class AccountTypeController {

    private final AccountTypeService accountTypeService;

    public AccountTypeController(AccountTypeService accountTypeService) {
        this.accountTypeService = accountTypeService;
    }

    @GetMapping
    public ResponseEntity<List<LedgerTypeResponse>> getAccountTypes() {
        return ResponseEntity.ok(accountTypeService.getAccountTypes());
    }

    @GetMapping("/{accountTypeId}")
    public ResponseEntity<LedgerTypeResponse> getAccountType(@PathVariable("accountTypeId") Long accountTypeId) {
        return ResponseEntity.ok(accountTypeService.getAccountType(accountTypeId));
    }

    @PostMapping
    public ResponseEntity<LedgerTypeResponse> createAccountType(@Valid @RequestBody LedgerTypeRequest request) {
        LedgerTypeResponse response = accountTypeService.createAccountType(request);
        return ResponseEntity.created(URI.create("/api/account-types/" + response.id())).body(response);
    }

    @PutMapping("/{accountTypeId}")
    public ResponseEntity<LedgerTypeResponse> updateAccountType(
            @PathVariable("accountTypeId") Long accountTypeId,
            @Valid @RequestBody LedgerTypeRequest request
    ) {
        return ResponseEntity.ok(accountTypeService.updateAccountType(accountTypeId, request));
    }

    @Operation(summary = "Delete an account type that no account uses")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "409", description = "Still referenced (RESOURCE_IN_USE)")
    })
    @DeleteMapping("/{accountTypeId}")
    public ResponseEntity<Void> deleteAccountType(@PathVariable("accountTypeId") Long accountTypeId) {
        accountTypeService.deleteAccountType(accountTypeId);
        return ResponseEntity.noContent().build();
    }
}
