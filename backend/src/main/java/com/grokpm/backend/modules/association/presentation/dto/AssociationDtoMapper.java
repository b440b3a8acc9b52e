package com.grokpm.backend.modules.association.presentation.dto;

import com.grokpm.backend.modules.association.domain.Association;
import com.grokpm.backend.modules.association.domain.BoardMember;
import com.grokpm.backend.modules.property.presentation.dto.PropertyDtoMapper;

public final class AssociationDtoMapper {

    private AssociationDtoMapper() {
    }

    public static AssociationResponse toResponse(Association association) {
        return new AssociationResponse(
                association.getId(),
                association.getName(),
                association.getContactInfo(),
                association.getFee(),
                association.getDueDate(),
                PropertyDtoMapper.toSummary(association.getProperty()),
                association.getBoardMembers().stream().map(AssociationDtoMapper::toBoardMemberSummary).toList(),
                association.getCreatedAt(),
                association.getUpdatedAt()
        );
    }

    public static AssociationSummary toSummary(Association association) {
        return new AssociationSummary(association.getId(), association.getName(), association.getFee());
    }

    public static BoardMemberResponse toBoardMemberResponse(BoardMember member) {
        return new BoardMemberResponse(
                member.getId(),
                member.getName(),
                member.getEmail(),
                member.getPhone(),
                toSummary(member.getAssociation()),
                member.getCreatedAt(),
                member.getUpdatedAt()
        );
    }

    public static BoardMemberSummary toBoardMemberSummary(BoardMember member) {
        return new BoardMemberSummary(member.getId(), member.getName(), member.getEmail(), member.getPhone());
    }
}
