package com.flagship.balance_ledger.api;

import com.flagship.balance_ledger.api.dto.BalanceAtTimeResponse;
import com.flagship.balance_ledger.api.dto.BalanceHistoryResponse;
import com.flagship.balance_ledger.api.dto.BalanceResponse;
import com.flagship.balance_ledger.api.dto.ReconciliationResponse;
import com.flagship.balance_ledger.balance.BalanceReader;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/accounts/{id}/balance")
@RequiredArgsConstructor
public class BalanceController {

    private final BalanceReader balanceReader;

    @GetMapping
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("id") long accountId) {
        return ResponseEntity.ok(BalanceResponse.from(balanceReader.getBalance(accountId)));
    }

    @GetMapping("/history")
    public ResponseEntity<List<BalanceHistoryResponse>> getHistory(
            @PathVariable("id") long accountId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {

        List<BalanceHistoryResponse> body = balanceReader.getHistory(accountId, limit, offset)
            .stream()
            .map(BalanceHistoryResponse::from)
            .toList();
        return ResponseEntity.ok(body);
    }

    /**
     * @param timestamp ISO-8601 instant, e.g. {@code 2024-01-01T00:00:00Z}
     */
    @GetMapping("/at")
    public ResponseEntity<BalanceAtTimeResponse> getBalanceAtTime(
            @PathVariable("id") long accountId,
            @RequestParam("timestamp") Instant timestamp) {

        BigDecimal amount = balanceReader.getBalanceAtTime(accountId, timestamp);
        return ResponseEntity.ok(new BalanceAtTimeResponse(accountId, timestamp, amount));
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconcile(@PathVariable("id") long accountId) {
        return ResponseEntity.ok(ReconciliationResponse.from(balanceReader.reconcile(accountId)));
    }
}
