package com.grokpm.backend.modules.ledger.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.ledger.domain.TransactionType;

public interface TransactionTypeRepository extends JpaRepository<TransactionType, Long> {

    List<TransactionType> findAllByOrderByIdAsc();

    boolean existsByNameIgnoreCase(String name);
}
