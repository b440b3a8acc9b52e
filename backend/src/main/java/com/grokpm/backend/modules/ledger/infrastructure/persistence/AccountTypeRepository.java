package com.grokpm.backend.modules.ledger.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.ledger.domain.AccountType;

public interface AccountTypeRepository extends JpaRepository<AccountType, Long> {

    List<AccountType> findAllByOrderByIdAsc();

    boolean existsByNameIgnoreCase(String name);
}
