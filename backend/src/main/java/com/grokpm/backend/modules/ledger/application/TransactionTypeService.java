package com.grokpm.backend.modules.ledger.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.ledger.domain.TransactionType;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.LedgerTransactionRepository;
import com.grokpm.backend.modules.ledger.infrastructure.persistence.TransactionTypeRepository;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerDtoMapper;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerTypeRequest;
import com.grokpm.backend.modules.ledger.presentation.dto.LedgerTypeResponse;

@Service
@Transactional
public class TransactionTypeService {

    private final TransactionTypeRepository transactionTypeRepository;
    private final LedgerTransactionRepository ledgerTransactionRepository;

    public TransactionTypeService(TransactionTypeRepository transactionTypeRepository, LedgerTransactionRepository ledgerTransactionRepository) {
        this.transactionTypeRepository = transactionTypeRepository;
        this.ledgerTransactionRepository = ledgerTransactionRepository;
    }

    @Transactional(readOnly = true)
    public List<LedgerTypeResponse> getTransactionTypes() {
        return transactionTypeRepository.findAllByOrderByIdAsc().stream()
                .map(LedgerDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public LedgerTypeResponse getTransactionType(Long transactionTypeId) {
        return LedgerDtoMapper.toResponse(load(transactionTypeId));
    }

    public LedgerTypeResponse createTransactionType(LedgerTypeRequest request) {
        String name = request.name().trim();
        ensureNameAvailable(name);
        TransactionType transactionType = new TransactionType();
        transactionType.setName(name);
        return LedgerDtoMapper.toResponse(transactionTypeRepository.saveAndFlush(transactionType));
    }

    public LedgerTypeResponse updateTransactionType(Long transactionTypeId, LedgerTypeRequest request) {
        TransactionType transactionType = load(transactionTypeId);
        String name = request.name().trim();
        if (!transactionType.getName().equalsIgnoreCase(name)) {
            ensureNameAvailable(name);
        }
        transactionType.setName(name);
        return LedgerDtoMapper.toResponse(transactionTypeRepository.saveAndFlush(transactionType));
    }

    public void deleteTransactionType(Long transactionTypeId) {
        TransactionType transactionType = load(transactionTypeId);
        if (ledgerTransactionRepository.existsByTransactionTypeId(transactionTypeId)) {
            throw ProblemException.inUse("Transaction type", transactionTypeId, "transactions");
        }
        transactionTypeRepository.delete(transactionType);
    }

    private void ensureNameAvailable(String name) {
        if (transactionTypeRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.conflict("TRANSACTION_TYPE_NAME_TAKEN", "Transaction type '" + name + "' already exists");
        }
    }

    private TransactionType load(Long transactionTypeId) {
        return transactionTypeRepository.findById(transactionTypeId)
                .orElseThrow(() -> ProblemException.notFound("TransactionType", transactionTypeId));
    }
}
