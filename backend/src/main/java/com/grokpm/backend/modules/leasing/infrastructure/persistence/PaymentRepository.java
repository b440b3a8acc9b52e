package com.grokpm.backend.modules.leasing.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.leasing.domain.Payment;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

    @EntityGraph(attributePaths = "tenant")
    List<Payment> findAllByOrderByIdAsc();

    @EntityGraph(attributePaths = "tenant")
    List<Payment> findByTenantIdOrderByIdAsc(Long tenantId);
}
