package com.grokpm.backend.modules.property.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateOwnerRequest(
        @NotBlank @Size(max = 150) String name,
        @Email @Size(max = 200) String email,
        @Size(max = 50) String phone,
        Long propertyId
) {
}
