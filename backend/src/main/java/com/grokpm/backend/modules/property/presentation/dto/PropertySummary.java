package com.grokpm.backend.modules.property.presentation.dto;

public record PropertySummary(
        Long id,
        String name,
        String status
) {
}
