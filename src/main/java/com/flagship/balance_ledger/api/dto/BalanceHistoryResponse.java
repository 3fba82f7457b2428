package com.flagship.balance_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.balance_ledger.ledger.BalanceHistoryEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BalanceHistoryResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("resulting_balance")
    BigDecimal resultingBalance;

    @JsonProperty("change_amount")
    BigDecimal changeAmount;

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BalanceHistoryResponse from(BalanceHistoryEntry entry) {
        return BalanceHistoryResponse.builder()
            .id(entry.getId())
            .accountId(entry.getAccountId())
            .resultingBalance(entry.getResultingBalance())
            .changeAmount(entry.getChangeAmount())
            .transactionId(entry.getTransactionId())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
