package com.flagship.balance_ledger.transaction;

import com.flagship.balance_ledger.config.PaginationPolicy;
import com.flagship.balance_ledger.exception.StorageException;
import com.flagship.balance_ledger.exception.TransactionNotFoundException;
import com.flagship.balance_ledger.ledger.LedgerValidation;
import com.flagship.balance_ledger.ledger.PageRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the transaction records.
 */
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    private final TransactionRecordRepository transactionRepository;
    private final PaginationPolicy paginationPolicy;

    @Transactional(readOnly = true)
    public TransactionRecord getTransaction(long transactionId) {
        LedgerValidation.requirePositiveId("transaction_id", transactionId);
        Optional<TransactionRecord> record;
        try {
            record = transactionRepository.findById(transactionId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read transaction " + transactionId, e);
        }
        return record.orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    /**
     * Transactions the account took part in, as source or destination,
     * newest first.
     */
    @Transactional(readOnly = true)
    public List<TransactionRecord> getAccountTransactions(long accountId, Integer limit, Integer offset) {
        LedgerValidation.requirePositiveId("account_id", accountId);
        PageRequest page = paginationPolicy.resolve(limit, offset);
        try {
            return transactionRepository.findByAccount(accountId, page);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list transactions of account " + accountId, e);
        }
    }
}
