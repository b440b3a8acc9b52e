package com.grokpm.backend.modules.ledger.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.ledger.domain.AccountType;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.AccountRepository;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.AccountTypeRepository;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerDtoMapper;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerTypeRequest;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerTypeResponse;

@Service
@Transactional
public class AccountTypeService {

    private final AccountTypeRepository accountTypeRepository;
    private final AccountRepository accountRepository;

    public AccountTypeService(AccountTypeRepository accountTypeRepository, AccountRepository accountRepository) {
        this.accountTypeRepository = accountTypeRepository;
        this.accountRepository = accountRepository;
    }

    @Transactional(readOnly = true)
    public List<LedgerTypeResponse> getAccountTypes() {
        return accountTypeRepository.findAllByOrderByIdAsc().stream()
                .map(LedgerDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public LedgerTypeResponse getAccountType(Long accountTypeId) {
        return LedgerDtoMapper.toResponse(load(accountTypeId));
    }

    public LedgerTypeResponse createAccountType(LedgerTypeRequest request) {
        String name = request.name().trim();
        ensureNameAvailable(name);
        AccountType accountType = new AccountType();
        accountType.setName(name);
        return LedgerDtoMapper.toResponse(accountTypeRepository.saveAndFlush(accountType));
    }

    public LedgerTypeResponse updateAccountType(Long accountTypeId, LedgerTypeRequest request) {
        AccountType accountType = load(accountTypeId);
        String name = request.name().trim();
        if (!accountType.getName().equalsIgnoreCase(name)) {
            ensureNameAvailable(name);
        }
        accountType.setName(name);
        return LedgerDtoMapper.toResponse(accountTypeRepository.saveAndFlush(accountType));
    }

    public void deleteAccountType(Long accountTypeId) {
        AccountType accountType = load(accountTypeId);
        if (accountRepository.existsByAccountTypeId(accountTypeId)) {
            throw ProblemException.inUse("Account type", accountTypeId, "accounts");
        }
        accountTypeRepository.delete(accountType);
    }

    private void ensureNameAvailable(String name) {
        if (accountTypeRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.conflict("ACCOUNT_TYPE_NAME_TAKEN", "Account type '" + name + "' already exists");
        }
    }

    private AccountType load(Long accountTypeId) {
        return accountTypeRepository.findById(accountTypeId)
                .orElseThrow(() -> ProblemException.notFound("AccountType", accountTypeId));
    }
}
