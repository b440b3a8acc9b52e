package com.grokpm.backend.modules.ledger.presentation.dto;

import java.time.OffsetDateTime;

/**
 * Shape shared by account types and transaction types, which both carry only a unique name.
 */
public record LedgerTypeResponse(Long id, String name, OffsetDateTime createdAt, OffsetDateTime updatedAt) {
}
