package com.grokpm.backend.modules.property.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.property.domain.Owner;

public interface OwnerRepository extends JpaRepository<Owner, Long> {

    @EntityGraph(attributePaths = "property")
    List<Owner> findAllByOrderByIdAsc();

    @EntityGraph(attributePaths = "property")
    List<Owner> findByPropertyIdOrderByIdAsc(Long propertyId);
}
