package com.grokpm.backend.modules.association.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import com.grokpm.backend.modules.property.presentation.dto.PropertySummary;

public record AssociationResponse(
        Long id,
        String name,
        String contactInfo,
        BigDecimal fee,
        LocalDate dueDate,
        PropertySummary property,
        List<BoardMemberSummary> boardMembers,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
