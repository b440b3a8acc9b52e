package com.grokpm.backend.modules.association.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.association.domain.Association;
import com.grokpm.backend.modules.association.domain.BoardMember;
import com.grokpm.backend.modules.association.infrastructure.persistence.AssociationRepository;
import com.grokpm.backend.modules.association.infrastructure.persistence.BoardMemberRepository;
import com.grokpm.backend.modules.association.presentation.dto.AssociationDtoMapper;
import com.grokpm.backend.modules.association.presentation.dto.BoardMemberResponse;
import com.grokpm.backend.modules.association.presentation.dto.CreateBoardMemberRequest;
import com.grokpm.backend.modules.association.presentation.dto.UpdateBoardMemberRequest;

@Service
@Transactional
public class BoardMemberService {

    private final BoardMemberRepository boardMemberRepository;
    private final AssociationRepository associationRepository;

    public BoardMemberService(BoardMemberRepository boardMemberRepository, AssociationRepository associationRepository) {
        this.boardMemberRepository = boardMemberRepository;
        this.associationRepository = associationRepository;
    }

    @Transactional(readOnly = true)
    public List<BoardMemberResponse> getBoardMembers(Long associationId) {
        List<BoardMember> members = associationId != null
                ? boardMemberRepository.findByAssociationIdOrderByIdAsc(associationId)
                : boardMemberRepository.findAllByOrderByIdAsc();
        return members.stream().map(AssociationDtoMapper::toBoardMemberResponse).toList();
    }

    @Transactional(readOnly = true)
    public BoardMemberResponse getBoardMember(Long memberId) {
        return AssociationDtoMapper.toBoardMemberResponse(loadMember(memberId));
    }

    public BoardMemberResponse createBoardMember(CreateBoardMemberRequest request) {
        BoardMember member = new BoardMember();
        member.setAssociation(resolveAssociation(request.associationId()));
        member.setName(request.name().trim());
        member.setEmail(request.email());
        member.setPhone(request.phone());
        return AssociationDtoMapper.toBoardMemberResponse(boardMemberRepository.saveAndFlush(member));
    }

    public BoardMemberResponse updateBoardMember(Long memberId, UpdateBoardMemberRequest request) {
        BoardMember member = loadMember(memberId);
        if (request.associationId() != null) {
            member.setAssociation(resolveAssociation(request.associationId()));
        }
        if (request.name() != null) {
            member.setName(request.name().trim());
        }
        if (request.email() != null) {
            member.setEmail(request.email());
        }
        if (request.phone() != null) {
            member.setPhone(request.phone());
        }
        return AssociationDtoMapper.toBoardMemberResponse(boardMemberRepository.saveAndFlush(member));
    }

    public void deleteBoardMember(Long memberId) {
        BoardMember member = loadMember(memberId);
        member.getAssociation().getBoardMembers().remove(member);
        boardMemberRepository.delete(member);
    }

    private BoardMember loadMember(Long memberId) {
        return boardMemberRepository.findById(memberId)
                .orElseThrow(() -> ProblemException.notFound("BoardMember", memberId));
    }

    private Association resolveAssociation(Long associationId) {
        return associationRepository.findById(associationId)
                .orElseThrow(() -> ProblemException.invalidReference("associationId", associationId));
    }
}
