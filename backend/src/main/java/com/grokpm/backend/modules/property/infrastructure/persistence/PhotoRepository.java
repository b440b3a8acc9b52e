package com.grokpm.backend.modules.property.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.property.domain.Photo;

public interface PhotoRepository extends JpaRepository<Photo, Long> {

    List<Photo> findAllByOrderByIdAsc();

    List<Photo> findByPropertyIdOrderByIdAsc(Long propertyId);

    List<Photo> findByUnitIdOrderByIdAsc(Long unitId);
}
