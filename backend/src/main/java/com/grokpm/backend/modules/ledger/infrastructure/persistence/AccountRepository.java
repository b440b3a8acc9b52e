package com.grokpm.backend.modules.ledger.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import com.grokpm.backend.modules.ledger.domain.Account;

public interface AccountRepository extends JpaRepository<Account, Long> {

    @EntityGraph(attributePaths = "accountType")
    List<Account> findAllByOrderByIdAsc();

    boolean existsByAccountTypeId(Long accountTypeId);
}
