package com.grokpm.backend.modules.ledger.presentation.dto;

public record AccountSummary(Long id, String name, LedgerTypeSummary accountType) {
}
