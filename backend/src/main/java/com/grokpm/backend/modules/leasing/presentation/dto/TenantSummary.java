package com.grokpm.backend.modules.leasing.presentation.dto;

public record TenantSummary(Long id, String name, String email, Long unitId) {
}
