package com.grokpm.backend.modules.association.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record UpdateAssociationRequest(
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") @Size(max = 150) String name,
        @Size(max = 200) String contactInfo,
        @PositiveOrZero @Digits(integer = 10, fraction = 2) BigDecimal fee,
        LocalDate dueDate,
        Long propertyId
) {
}
