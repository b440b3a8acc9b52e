package com.grokpm.backend.modules.property.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PhotoInput(
        Long id,
        @NotBlank @Size(max = 500) String url,
        @Size(max = 200) String name,
        Boolean primary
) {
}
