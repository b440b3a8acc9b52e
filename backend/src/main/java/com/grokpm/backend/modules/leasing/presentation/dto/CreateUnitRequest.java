package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateUnitRequest(
        @NotNull Long addressId,
        @NotBlank @Size(max = 30) String unitNumber,
        @PositiveOrZero @Digits(integer = 10, fraction = 2) BigDecimal rentAmount,
        @Size(max = 30) String status
) {
}
