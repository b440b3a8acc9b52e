package com.grokpm.backend.modules.property.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateOwnerRequest(
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") @Size(max = 150) String name,
        @Email @Size(max = 200) String email,
        @Size(max = 50) String phone,
        Long propertyId
) {
}
