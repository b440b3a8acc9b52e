package com.grokpm.backend.modules.association.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateBoardMemberRequest(
        @NotNull Long associationId,
        @NotBlank @Size(max = 150) String name,
        @Email @Size(max = 200) String email,
        @Size(max = 50) String phone
) {
}
