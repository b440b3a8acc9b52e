package com.grokpm.backend.modules.property.presentation.dto;

public record OwnerSummary(
        Long id,
        String name,
        String email,
        String phone
) {
}
