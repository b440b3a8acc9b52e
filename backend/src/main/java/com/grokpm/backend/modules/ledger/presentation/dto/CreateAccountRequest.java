package com.grokpm.backend.modules.ledger.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateAccountRequest(
        @NotNull Long accountTypeId,
        @NotBlank @Size(max = 150) String name
) {
}
