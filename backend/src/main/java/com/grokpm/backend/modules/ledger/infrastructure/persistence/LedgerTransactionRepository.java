package com.grokpm.backend.modules.ledger.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.grokpm.backend.modules.ledger.domain.LedgerTransaction;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {

    @Query("""
            select t from LedgerTransaction t
              join fetch t.account a
              join fetch a.accountType
              join fetch t.property p
              left join fetch t.transactionType
             where (:propertyId is null or p.id = :propertyId)
               and (:accountId is null or a.id = :accountId)
             order by t.id asc
            """)
    List<LedgerTransaction> search(@Param("propertyId") Long propertyId, @Param("accountId") Long accountId);

    boolean existsByAccountId(Long accountId);

    boolean existsByTransactionTypeId(Long transactionTypeId);
}
