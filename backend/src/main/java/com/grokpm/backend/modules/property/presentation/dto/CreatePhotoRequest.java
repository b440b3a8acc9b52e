package com.grokpm.backend.modules.property.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Exactly one of {@code propertyId} and {@code unitId} must be given.
 */
public record CreatePhotoRequest(
        @NotBlank @Size(max = 500) String url,
        @Size(max = 200) String name,
        Boolean primary,
        Long propertyId,
        Long unitId
) {
}
