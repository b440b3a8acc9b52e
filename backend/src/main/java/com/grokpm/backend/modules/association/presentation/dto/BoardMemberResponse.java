package com.grokpm.backend.modules.association.presentation.dto;

import java.time.OffsetDateTime;

public record BoardMemberResponse(
        Long id,
        String name,
        String email,
        String phone,
        AssociationSummary association,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
