package com.grokpm.backend.modules.association.presentation.dto;

public record BoardMemberSummary(Long id, String name, String email, String phone) {
}
