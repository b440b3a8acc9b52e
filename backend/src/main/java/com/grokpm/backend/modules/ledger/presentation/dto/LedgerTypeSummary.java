package com.grokpm.backend.modules.ledger.presentation.dto;

public record LedgerTypeSummary(Long id, String name) {
}
