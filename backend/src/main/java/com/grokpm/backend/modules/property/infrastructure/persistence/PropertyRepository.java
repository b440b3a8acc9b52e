package com.grokpm.backend.modules.property.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.property.domain.Property;

public interface PropertyRepository extends JpaRepository<Property, Long> {

    List<Property> findByStatusIgnoreCaseOrderByIdAsc(String status);

    List<Property> findAllByOrderByIdAsc();
}
