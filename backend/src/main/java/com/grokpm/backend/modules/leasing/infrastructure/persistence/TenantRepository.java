package com.grokpm.backend.modules.leasing.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.leasing.domain.Tenant;

public interface TenantRepository extends JpaRepository<Tenant, Long> {

    @EntityGraph(attributePaths = "unit")
    List<Tenant> findAllByOrderByIdAsc();

    @EntityGraph(attributePaths = "unit")
    List<Tenant> findByUnitIdOrderByIdAsc(Long unitId);
}
