package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreatePaymentRequest(
        @NotNull Long tenantId,
        @NotNull @PositiveOrZero @Digits(integer = 10, fraction = 2) BigDecimal amount,
        LocalDate date,
        @Size(max = 30) String status
) {
}
