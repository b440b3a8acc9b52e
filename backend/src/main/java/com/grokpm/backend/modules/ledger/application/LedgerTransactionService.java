package com.grokpm.backend.modules.ledger.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.ledger.domain.Account;
import com.grokpm.backend.modules.ledger.domain.LedgerTransaction;
import com.grokpm.backend.modules.ledger.domain.TransactionType;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.AccountRepository;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.LedgerTransactionRepository;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.TransactionTypeRepository;
import com.grokpm.backend.modules.ledger.presentation.dto.CreateTransactionRequest;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerDtoMapper;
import com.grokpm.backend.modules.ledger.presentation.dto.TransactionResponse;
import com.grokpm.backend.modules.ledger.presentation.dto.UpdateTransactionRequest;
import com.grokpm.backend.modules.property.domain.Property;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;

@Service
@Transactional
public class LedgerTransactionService {

    private final LedgerTransactionRepository ledgerTransactionRepository;
    private final AccountRepository accountRepository;
    private final TransactionTypeRepository transactionTypeRepository;
    private final PropertyRepository propertyRepository;
    private final Clock clock;

    public LedgerTransactionService(
            LedgerTransactionRepository ledgerTransactionRepository,
            AccountRepository accountRepository,
            TransactionTypeRepository transactionTypeRepository,
            PropertyRepository propertyRepository,
            Clock clock
    ) {
        this.ledgerTransactionRepository = ledgerTransactionRepository;
        this.accountRepository = accountRepository;
        this.transactionTypeRepository = transactionTypeRepository;
        this.propertyRepository = propertyRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<TransactionResponse> getTransactions(Long propertyId, Long accountId) {
        return ledgerTransactionRepository.search(propertyId, accountId).stream()
                .map(LedgerDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public TransactionResponse getTransaction(Long transactionId) {
        return LedgerDtoMapper.toResponse(loadTransaction(transactionId));
    }

    public TransactionResponse createTransaction(CreateTransactionRequest request) {
        LedgerTransaction transaction = new LedgerTransaction();
        transaction.setAccount(resolveAccount(request.accountId()));
        transaction.setProperty(resolveProperty(request.propertyId()));
        if (request.transactionTypeId() != null) {
            transaction.setTransactionType(resolveTransactionType(request.transactionTypeId()));
        }
        transaction.setAmount(request.amount());
        transaction.setDate(request.date() != null ? request.date() : LocalDate.now(clock));
        transaction.setDescription(request.description());
        return LedgerDtoMapper.toResponse(ledgerTransactionRepository.saveAndFlush(transaction));
    }

    public TransactionResponse updateTransaction(Long transactionId, UpdateTransactionRequest request) {
        LedgerTransaction transaction = loadTransaction(transactionId);
        if (request.accountId() != null) {
            transaction.setAccount(resolveAccount(request.accountId()));
        }
        if (request.propertyId() != null) {
            transaction.setProperty(resolveProperty(request.propertyId()));
        }
        if (request.transactionTypeId() != null) {
            transaction.setTransactionType(resolveTransactionType(request.transactionTypeId()));
        }
        if (request.amount() != null) {
            transaction.setAmount(request.amount());
        }
        if (request.date() != null) {
            transaction.setDate(request.date());
        }
        if (request.description() != null) {
            transaction.setDescription(request.description());
        }
        return LedgerDtoMapper.toResponse(ledgerTransactionRepository.saveAndFlush(transaction));
    }

    public void deleteTransaction(Long transactionId) {
        ledgerTransactionRepository.delete(loadTransaction(transactionId));
    }

    private LedgerTransaction loadTransaction(Long transactionId) {
        return ledgerTransactionRepository.findById(transactionId)
                .orElseThrow(() -> ProblemException.notFound("Transaction", transactionId));
    }

    private Account resolveAccount(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> ProblemException.invalidReference("accountId", accountId));
    }

    private TransactionType resolveTransactionType(Long transactionTypeId) {
        return transactionTypeRepository.findById(transactionTypeId)
                .orElseThrow(() -> ProblemException.invalidReference("transactionTypeId", transactionTypeId));
    }

    private Property resolveProperty(Long propertyId) {
        return propertyRepository.findById(propertyId)
                .orElseThrow(() -> ProblemException.invalidReference("propertyId", propertyId));
    }
}
