package com.grokpm.backend.modules.ledger.presentation.dto;

import com.grokpm.backend.modules.ledger.domain.Account;
import com.grokpm.backend.modules.ledger.domain.AccountType;
import com.grokpm.backend.modules.ledger.domain.LedgerTransaction;
import com.grokpm.backend.modules.ledger.domain.TransactionType;
import com.grokpm.backend.modules.property.presentation.dto.PropertyDtoMapper;

public final class LedgerDtoMapper {

    private LedgerDtoMapper() {
    }

    public static LedgerTypeResponse toResponse(AccountType type) {
        return new LedgerTypeResponse(type.getId(), type.getName(), type.getCreatedAt(), type.getUpdatedAt());
    }

    public static LedgerTypeResponse toResponse(TransactionType type) {
        return new LedgerTypeResponse(type.getId(), type.getName(), type.getCreatedAt(), type.getUpdatedAt());
    }

    public static AccountResponse toResponse(Account account) {
        return new AccountResponse(
                account.getId(),
                account.getName(),
                toSummary(account.getAccountType()),
                account.getTransactions().size(),
                account.getBalance(),
                account.getCreatedAt(),
                account.getUpdatedAt()
        );
    }

    public static TransactionResponse toResponse(LedgerTransaction transaction) {
        Account account = transaction.getAccount();
        TransactionType type = transaction.getTransactionType();
        return new TransactionResponse(
                transaction.getId(),
                transaction.getAmount(),
                transaction.getDate(),
                transaction.getDescription(),
                new AccountSummary(account.getId(), account.getName(), toSummary(account.getAccountType())),
                type != null ? new LedgerTypeSummary(type.getId(), type.getName()) : null,
                PropertyDtoMapper.toSummary(transaction.getProperty()),
                transaction.getCreatedAt(),
                transaction.getUpdatedAt()
        );
    }

    private static LedgerTypeSummary toSummary(AccountType type) {
        return new LedgerTypeSummary(type.getId(), type.getName());
    }
}
