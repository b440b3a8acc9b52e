package com.grokpm.backend.modules.ledger.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LedgerTypeRequest(@NotBlank @Size(max = 100) String name) {
}
