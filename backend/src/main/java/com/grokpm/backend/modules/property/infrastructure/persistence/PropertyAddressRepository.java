package com.grokpm.backend.modules.property.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.property.domain.PropertyAddress;

public interface PropertyAddressRepository extends JpaRepository<PropertyAddress, Long> {

    List<PropertyAddress> findByPropertyIdOrderByIdAsc(Long propertyId);
}
