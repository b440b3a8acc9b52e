package com.grokpm.backend.modules.ledger.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.ledger.domain.Account;
import com.grokpm.backend.modules.ledger.domain.AccountType;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.AccountRepository;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.AccountTypeRepository;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.LedgerTransactionRepository;
import com.grokpm.backend.modules.ledger.presentation.dto.AccountResponse;
import com.grokpm.backend.modules.ledger.presentation.dto.CreateAccountRequest;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerDtoMapper;
import com.grokpm.backend.modules.ledger.presentation.dto.UpdateAccountRequest;

/**
 * Ledger accounts. An account that still has transactions cannot be deleted; the caller has to remove or move the
 * transactions first.
 */
@Service
@Transactional
public class AccountService {

    private final AccountRepository accountRepository;
    private final AccountTypeRepository accountTypeRepository;
    private final LedgerTransactionRepository ledgerTransactionRepository;

    public AccountService(
            AccountRepository accountRepository,
            AccountTypeRepository accountTypeRepository,
            LedgerTransactionRepository ledgerTransactionRepository
    ) {
        this.accountRepository = accountRepository;
        this.accountTypeRepository = accountTypeRepository;
        this.ledgerTransactionRepository = ledgerTransactionRepository;
    }

    @Transactional(readOnly = true)
    public List<AccountResponse> getAccounts() {
        return accountRepository.findAllByOrderByIdAsc().stream()
                .map(LedgerDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public AccountResponse getAccount(Long accountId) {
        return LedgerDtoMapper.toResponse(loadAccount(accountId));
    }

    public AccountResponse createAccount(CreateAccountRequest request) {
        Account account = new Account();
        account.setAccountType(resolveAccountType(request.accountTypeId()));
        account.setName(request.name().trim());
        return LedgerDtoMapper.toResponse(accountRepository.saveAndFlush(account));
    }

    public AccountResponse updateAccount(Long accountId, UpdateAccountRequest request) {
        Account account = loadAccount(accountId);
        if (request.accountTypeId() != null) {
            account.setAccountType(resolveAccountType(request.accountTypeId()));
        }
        if (request.name() != null) {
            account.setName(request.name().trim());
        }
        return LedgerDtoMapper.toResponse(accountRepository.saveAndFlush(account));
    }

    public void deleteAccount(Long accountId) {
        Account account = loadAccount(accountId);
        if (ledgerTransactionRepository.existsByAccountId(accountId)) {
            throw ProblemException.inUse("Account", accountId, "transactions");
        }
        accountRepository.delete(account);
    }

    private Account loadAccount(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> ProblemException.notFound("Account", accountId));
    }

    private AccountType resolveAccountType(Long accountTypeId) {
        return accountTypeRepository.findById(accountTypeId)
                .orElseThrow(() -> ProblemException.invalidReference("accountTypeId", accountTypeId));
    }
}
