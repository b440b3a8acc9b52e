package com.grokpm.backend.modules.property.presentation.dto;

import jakarta.validation.constraints.Size;

public record CreateAddressRequest(
        @Size(max = 200) String street,
        @Size(max = 100) String city,
        @Size(max = 50) String state,
        @Size(max = 20) String zip,
        Boolean primary
) {
}
