package com.grokpm.backend.modules.association.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.association.domain.BoardMember;

public interface BoardMemberRepository extends JpaRepository<BoardMember, Long> {

    @EntityGraph(attributePaths = "association")
    List<BoardMember> findAllByOrderByIdAsc();

    @EntityGraph(attributePaths = "association")
    List<BoardMember> findByAssociationIdOrderByIdAsc(Long associationId);
}
