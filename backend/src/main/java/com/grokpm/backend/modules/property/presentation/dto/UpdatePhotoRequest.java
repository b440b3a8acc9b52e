package com.grokpm.backend.modules.property.presentation.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdatePhotoRequest(
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") @Size(max = 500) String url,
        @Size(max = 200) String name,
        Boolean primary
) {
}
