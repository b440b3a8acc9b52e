package com.grokpm.backend.modules.ledger.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

public record UpdateTransactionRequest(
        Long accountId,
        Long propertyId,
        Long transactionTypeId,
        @Digits(integer = 10, fraction = 2) BigDecimal amount,
        LocalDate date,
        @Size(max = 500) String description
) {
}
