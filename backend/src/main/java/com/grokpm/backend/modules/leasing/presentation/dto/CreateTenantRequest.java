package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateTenantRequest(
        @NotNull Long unitId,
        @NotBlank @Size(max = 150) String name,
        @Email @Size(max = 200) String email,
        @Size(max = 50) String phone,
        LocalDate leaseStartDate,
        LocalDate leaseEndDate,
        @PositiveOrZero @Digits(integer = 10, fraction = 2) BigDecimal rent
) {
}
