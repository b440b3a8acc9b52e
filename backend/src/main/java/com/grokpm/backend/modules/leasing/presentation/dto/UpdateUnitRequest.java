package com.grokpm.backend.modules.leasing.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record UpdateUnitRequest(
        Long addressId,
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") @Size(max = 30) String unitNumber,
        @PositiveOrZero @Digits(integer = 10, fraction = 2) BigDecimal rentAmount,
        @Size(max = 30) String status
) {
}
