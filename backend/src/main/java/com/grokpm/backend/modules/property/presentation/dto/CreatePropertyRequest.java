package com.grokpm.backend.modules.property.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreatePropertyRequest(
        @NotBlank @Size(max = 150) String name,
        @Size(max = 50) String type,
        @Size(max = 30) String status,
        @PositiveOrZero @Digits(integer = 12, fraction = 2) BigDecimal value,
        List<@NotNull @Valid AddressInput> addresses,
        List<@NotNull @Valid PhotoInput> photos
) {
}
