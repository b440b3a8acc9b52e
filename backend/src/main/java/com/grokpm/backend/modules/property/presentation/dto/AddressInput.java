package com.grokpm.backend.modules.property.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * One entry of a property's submitted address list. {@code id} refers to an existing address to update; when it
 * is absent or unknown a new address is inserted.
 */
public record AddressInput(
        Long id,
        @Size(max = 200) String street,
        @Size(max = 100) String city,
        @Size(max = 50) String state,
        @Size(max = 20) String zip
) {
}
