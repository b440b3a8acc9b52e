package com.grokpm.backend.modules.property.presentation.dto;

public record AddressSummary(
        Long id,
        Long propertyId,
        String street,
        String city,
        String state,
        String zip,
        boolean primary
) {
}
