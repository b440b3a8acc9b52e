package com.grokpm.backend.modules.ledger.presentation.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateAccountRequest(
        Long accountTypeId,
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") @Size(max = 150) String name
) {
}
