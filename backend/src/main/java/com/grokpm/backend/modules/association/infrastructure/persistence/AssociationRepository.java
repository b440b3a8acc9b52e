package com.grokpm.backend.modules.association.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.association.domain.Association;

public interface AssociationRepository extends JpaRepository<Association, Long> {

    @EntityGraph(attributePaths = "property")
    List<Association> findAllByOrderByIdAsc();

    @EntityGraph(attributePaths = "property")
    List<Association> findByPropertyIdOrderByIdAsc(Long propertyId);
}
