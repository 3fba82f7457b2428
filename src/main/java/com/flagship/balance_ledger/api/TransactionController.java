package com.flagship.balance_ledger.api;

import com.flagship.balance_ledger.api.dto.CreditRequest;
import com.flagship.balance_ledger.api.dto.DebitRequest;
import com.flagship.balance_ledger.api.dto.TransactionResponse;
import com.flagship.balance_ledger.api.dto.TransferRequest;
import com.flagship.balance_ledger.observability.CorrelationContext;
import com.flagship.balance_ledger.transaction.TransactionOrchestrator;
import com.flagship.balance_ledger.transaction.TransactionQueryService;
import com.flagship.balance_ledger.transaction.TransactionRecord;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST adapter for credits, debits, transfers and rollbacks.
 *
 * Callers are authenticated upstream; their identity headers only reach the
 * logs, through {@link com.flagship.balance_ledger.observability.CorrelationIdFilter}.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionOrchestrator orchestrator;
    private final TransactionQueryService queryService;

    @PostMapping("/credit")
    public ResponseEntity<TransactionResponse> credit(@Valid @RequestBody CreditRequest request) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(request.getAccountId()));
        log.info("Received credit request: amount={}", request.getAmount().toPlainString());

        TransactionRecord record = orchestrator.credit(request.getAccountId(), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(record));
    }

    @PostMapping("/debit")
    public ResponseEntity<TransactionResponse> debit(@Valid @RequestBody DebitRequest request) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(request.getAccountId()));
        log.info("Received debit request: amount={}", request.getAmount().toPlainString());

        TransactionRecord record = orchestrator.debit(request.getAccountId(), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(record));
    }

    @PostMapping("/transfer")
    public ResponseEntity<TransactionResponse> transfer(@Valid @RequestBody TransferRequest request) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(request.getSourceAccountId()));
        log.info("Received transfer request: dest={}, amount={}",
                request.getDestAccountId(), request.getAmount().toPlainString());

        TransactionRecord record = orchestrator.transfer(
            request.getSourceAccountId(),
            request.getDestAccountId(),
            request.getAmount()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(record));
    }

    @PostMapping("/{id}/rollback")
    public ResponseEntity<TransactionResponse> rollback(@PathVariable("id") long id) {
        log.info("Received rollback request: transactionId={}", id);
        return ResponseEntity.ok(TransactionResponse.from(orchestrator.rollback(id)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") long id) {
        return ResponseEntity.ok(TransactionResponse.from(queryService.getTransaction(id)));
    }

    /**
     * Transactions of one account, newest first.
     */
    @GetMapping
    public ResponseEntity<List<TransactionResponse>> getAccountTransactions(
            @RequestParam("account_id") long accountId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {

        List<TransactionResponse> body = queryService.getAccountTransactions(accountId, limit, offset)
            .stream()
            .map(TransactionResponse::from)
            .toList();
        return ResponseEntity.ok(body);
    }
}
